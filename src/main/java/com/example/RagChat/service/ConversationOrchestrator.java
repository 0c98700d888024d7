package com.example.RagChat.service;

import com.example.RagChat.config.RagChatProperties;
import com.example.RagChat.exception.GenerationFailedException;
import com.example.RagChat.exception.RetrievalDegradedException;
import com.example.RagChat.exception.TurnTimeoutException;
import com.example.RagChat.exception.ValidationBlockedException;
import com.example.RagChat.guardrail.GuardrailResult;
import com.example.RagChat.guardrail.GuardrailsEngine;
import com.example.RagChat.model.BlockReason;
import com.example.RagChat.model.ChatResponse;
import com.example.RagChat.model.Direction;
import com.example.RagChat.model.GuardrailViolation;
import com.example.RagChat.model.Message;
import com.example.RagChat.model.RagQueryRequest;
import com.example.RagChat.model.RagRetrievalResult;
import com.example.RagChat.model.RetrievedResult;
import com.example.RagChat.model.SessionEvent;
import com.example.RagChat.model.SourceRef;
import com.example.RagChat.model.TurnState;
import com.example.RagChat.model.ViolationKind;
import com.example.RagChat.session.SessionStore;
import com.example.RagChat.session.UserLocks;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs one conversational turn:
 *  - validate the input with the guardrails (a HIGH finding blocks the turn)
 *  - retrieve context from the vector index (failures degrade to no context)
 *  - build the prompt from history, context and question
 *  - call the LLM with bounded retries
 *  - validate the output (a HIGH finding discards the answer)
 *  - append the sanitized user and assistant messages to the session
 *
 * Turns of the same user are serialized; the whole turn runs under one deadline, including the
 * session reads and the durable part of the final write.
 * Every path ends in a {@link ChatResponse}, nothing escapes {@link #chat}.
 */
@Service
@RequiredArgsConstructor
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    static final String GENERATION_FAILED_MESSAGE =
            "I apologize, but I encountered an error processing your request. Please try again later.";
    static final String TIMEOUT_MESSAGE =
            "The request took too long to process. Please try again.";
    static final String INTERNAL_ERROR_MESSAGE =
            "I apologize, but something went wrong while handling your request.";
    static final String MISSING_USER_MESSAGE =
            "A user id is required to start a conversation.";

    private final GuardrailsEngine guardrails;
    private final RetrievalService retrievalService;
    private final SessionStore sessionStore;
    private final LlmClient llmClient;
    private final TurnAuditService turnAuditService;
    private final RagChatProperties properties;
    private final Clock clock;

    private final UserLocks turnLocks = new UserLocks();

    public ChatResponse chat(String userId, String query) {
        if (userId == null || userId.isBlank()) {
            // no session to attach the turn to, so nothing is recorded or audited
            log.warn("Rejected turn without a user id");
            return ChatResponse.blocked(MISSING_USER_MESSAGE, BlockReason.INTERNAL_ERROR, List.of(),
                    sessionStore.backend());
        }
        Turn turn = new Turn(userId, query == null ? "" : query, clock.instant(), properties.getTurnDeadline());

        ChatResponse response;
        try {
            response = runSerialized(turn);
        } catch (ValidationBlockedException e) {
            response = blockOnGuardrails(turn, e.getViolations());
        } catch (GenerationFailedException e) {
            log.warn("Generation failed for user {} after {} attempt(s)", userId, e.getAttempts(), e);
            recordBlockEvent(turn, "generation_failed", e.getMessage());
            response = block(turn, BlockReason.GENERATION_FAILED, GENERATION_FAILED_MESSAGE);
        } catch (TurnTimeoutException e) {
            log.warn("Turn for user {} timed out in state {}: {}", userId, turn.state, e.getMessage());
            response = block(turn, BlockReason.TIMEOUT, TIMEOUT_MESSAGE);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in turn for user {} (state {})", userId, turn.state, e);
            response = block(turn, BlockReason.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
        }

        turnAuditService.record(userId, turn.sanitizedQuestion, turn.prompt, response,
                Duration.between(turn.startedAt, clock.instant()));
        return response;
    }

    /** Users with a turn in progress or waiting for one. */
    int activeUserCount() {
        return turnLocks.size();
    }

    private ChatResponse runSerialized(Turn turn) {
        try {
            return turnLocks.withLock(turn.userId, turn.remaining("waiting for the session"), () -> run(turn));
        } catch (UserLocks.LockTimeoutException e) {
            throw new TurnTimeoutException("waiting for the session", turn.deadline, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnTimeoutException("waiting for the session", turn.deadline, e);
        }
    }

    private ChatResponse run(Turn turn) {
        // 1) Input guardrails
        turn.moveTo(TurnState.INPUT_VALIDATING);
        GuardrailResult input = guardrails.validate(turn.query, Direction.INPUT);
        turn.violations.addAll(input.violations());
        if (input.blocked()) {
            throw new ValidationBlockedException(input.blockingViolations());
        }
        turn.sanitizedQuestion = input.sanitizedText();

        // 2) Retrieval
        turn.moveTo(TurnState.RETRIEVING);
        RagRetrievalResult retrieval = retrieve(turn);

        // 3) Prompt + generation
        turn.moveTo(TurnState.GENERATING);
        String history = awaitWithinDeadline(turn, "loading the conversation",
                Mono.fromCallable(() -> sessionStore.asPromptContext(turn.userId)));
        turn.prompt = buildPrompt(turn.sanitizedQuestion, retrieval, history);
        String answer = generate(turn);

        // 4) Output guardrails
        turn.moveTo(TurnState.OUTPUT_VALIDATING);
        GuardrailResult output = guardrails.validate(answer, Direction.OUTPUT);
        turn.violations.addAll(output.violations());
        if (output.blocked()) {
            // the answer is discarded here, only the violations leave this method
            throw new ValidationBlockedException(output.blockingViolations());
        }

        // 5) Persist the turn, once, only if still within the deadline.
        // The local write commits it; the durable copy is synced later if the deadline passes first.
        turn.remaining("saving the conversation");
        Instant now = clock.instant();
        List<String> chunkIds = retrieval.results().stream()
                .map(r -> r.chunk().id())
                .toList();
        sessionStore.appendTurn(turn.userId,
                Message.user(turn.sanitizedQuestion, now, input.modified()),
                Message.assistant(output.sanitizedText(), now, chunkIds, output.modified()),
                turn.expiresAt);

        turn.moveTo(TurnState.COMPLETED);
        return ChatResponse.completed(output.sanitizedText(), toSources(retrieval.results()), turn.violations,
                sessionStore.backend());
    }

    /**
     * Retrieval is best-effort: any failure other than the deadline means answering without context.
     */
    private RagRetrievalResult retrieve(Turn turn) {
        RagQueryRequest request = new RagQueryRequest(turn.sanitizedQuestion, null, null);
        RagRetrievalResult result;
        try {
            result = awaitWithinDeadline(turn, "retrieval", Mono.fromCallable(() -> retrievalService.retrieve(request)));
        } catch (TurnTimeoutException e) {
            throw e;
        } catch (RetrievalDegradedException e) {
            log.warn("Retrieval degraded for user {}, answering without context: {}", turn.userId, e.getMessage());
            return RagRetrievalResult.empty(turn.sanitizedQuestion);
        } catch (RuntimeException e) {
            log.warn("Retrieval failed for user {}, answering without context", turn.userId, e);
            return RagRetrievalResult.empty(turn.sanitizedQuestion);
        }
        return result != null ? result : RagRetrievalResult.empty(turn.sanitizedQuestion);
    }

    private String generate(Turn turn) {
        RagChatProperties.Generation generation = properties.getGeneration();
        RagChatProperties.Retry retry = generation.getRetry();
        return awaitWithinDeadline(turn, "generation",
                Mono.fromCallable(() -> llmClient.generate(turn.prompt, generation.getTemperature(), generation.getMaxTokens()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .retryWhen(Retry.backoff(Math.max(0, retry.getMaxAttempts()), retry.getBackoff())
                                .doBeforeRetry(signal -> log.debug("Retrying LLM call for user {} (retry {}): {}",
                                        turn.userId, signal.totalRetries() + 1, signal.failure().getMessage()))
                                .onRetryExhaustedThrow((backoffSpec, signal) ->
                                        new GenerationFailedException((int) signal.totalRetries() + 1, signal.failure()))));
    }

    /**
     * Blocks on {@code work} for at most the time left in the turn.
     *
     * @throws TurnTimeoutException when the deadline passes first
     */
    private <T> T awaitWithinDeadline(Turn turn, String stage, Mono<T> work) {
        Duration remaining = turn.remaining(stage);
        try {
            return work.subscribeOn(Schedulers.boundedElastic())
                    .timeout(remaining)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new TurnTimeoutException(stage, turn.deadline, cause);
            }
            throw e;
        }
    }

    private String buildPrompt(String question, RagRetrievalResult retrieval, String historyText) {
        StringBuilder sb = new StringBuilder();
        sb.append("Conversation History:\n").append(historyText).append("\n\n");
        sb.append("Retrieved Context:\n").append(retrieval.context()).append("\n\n");
        sb.append("User Question: ").append(question).append("\n");
        sb.append("If the context does not contain the answer, say that you don't know. ");
        sb.append("Cite the sources you used.");
        return sb.toString();
    }

    private ChatResponse blockOnGuardrails(Turn turn, List<GuardrailViolation> blocking) {
        String summary = summarize(blocking);
        boolean input = blocking.stream().allMatch(v -> v.direction() == Direction.INPUT);
        log.debug("Turn for user {} blocked by {} guardrails: {}", turn.userId, input ? "input" : "output", summary);
        if (input) {
            recordBlockEvent(turn, "input_blocked", summary);
            return block(turn, BlockReason.INPUT_GUARDRAIL, "I can't help with that request: " + summary + ".");
        }
        recordBlockEvent(turn, "output_blocked", summary);
        return block(turn, BlockReason.OUTPUT_GUARDRAIL, "The generated answer was withheld: " + summary + ".");
    }

    private ChatResponse block(Turn turn, BlockReason reason, String message) {
        turn.moveTo(TurnState.BLOCKED);
        return ChatResponse.blocked(message, reason, turn.violations, sessionStore.backend());
    }

    private void recordBlockEvent(Turn turn, String type, String detail) {
        try {
            sessionStore.recordEvent(turn.userId, new SessionEvent(type, detail, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Could not record {} event for user {}", type, turn.userId, e);
        }
    }

    private static List<SourceRef> toSources(List<RetrievedResult> results) {
        return results.stream().map(SourceRef::of).toList();
    }

    private static String summarize(List<GuardrailViolation> violations) {
        return violations.stream()
                .map(GuardrailViolation::kind)
                .distinct()
                .map(ViolationKind::description)
                .collect(Collectors.joining("; "));
    }

    /**
     * Mutable bookkeeping of a single turn. Confined to the thread running it.
     */
    private final class Turn {
        final String userId;
        final String query;
        final Instant startedAt;
        final Duration deadline;
        final Instant expiresAt;
        final List<GuardrailViolation> violations = new ArrayList<>();
        TurnState state = TurnState.RECEIVED;
        String sanitizedQuestion;
        String prompt;

        Turn(String userId, String query, Instant startedAt, Duration deadline) {
            this.userId = userId;
            this.query = query;
            this.startedAt = startedAt;
            this.deadline = deadline;
            this.expiresAt = startedAt.plus(deadline);
        }

        void moveTo(TurnState next) {
            log.debug("Turn for user {}: {} -> {}", userId, state, next);
            state = next;
        }

        /**
         * Time left before the deadline; throws when it has already passed.
         */
        Duration remaining(String stage) {
            Duration left = Duration.between(clock.instant(), expiresAt);
            if (left.isNegative() || left.isZero()) {
                throw new TurnTimeoutException(stage, deadline);
            }
            return left;
        }
    }
}
