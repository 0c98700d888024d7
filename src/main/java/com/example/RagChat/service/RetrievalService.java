package com.example.RagChat.service;

import com.example.RagChat.config.RagChatProperties;
import com.example.RagChat.exception.RetrievalDegradedException;
import com.example.RagChat.index.VectorIndex;
import com.example.RagChat.model.RagQueryRequest;
import com.example.RagChat.model.RagRetrievalResult;
import com.example.RagChat.model.RetrievedResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Retrieval-only service:
 * - Queries the vector index for the top-K chunks
 * - Applies score filtering (with dynamic score adaptation)
 * - Builds LLM-ready context text
 *
 * This service does NOT call any chat/LLM APIs.
 */
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    /**
     * Margin from the top score used for dynamic thresholding.
     * Example: if topScore = 0.82 and margin = 0.10, dynamic threshold ~0.72.
     */
    private static final double TOP_SCORE_MARGIN = 0.10;

    /**
     * Absolute lower bound when all scores are low.
     */
    private static final double ABSOLUTE_FLOOR_SCORE = 0.25;

    private final VectorIndex vectorIndex;
    private final RagChatProperties properties;

    /**
     * @throws RetrievalDegradedException when the index or embedding provider is unavailable
     */
    public RagRetrievalResult retrieve(RagQueryRequest request) {
        String question = request.question();
        RagChatProperties.Retrieval defaults = properties.getRetrieval();
        int topK = request.resolveTopK(defaults.getTopK());
        double requestedMinScore = request.resolveMinScore(defaults.getMinScore());

        List<RetrievedResult> retrieved;
        try {
            retrieved = vectorIndex.search(question, topK);
        } catch (RetrievalDegradedException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalDegradedException("Vector index search failed", e);
        }

        if (retrieved.isEmpty()) {
            log.debug("Retrieval: no chunks found for question='{}'", question);
            return RagRetrievalResult.empty(question);
        }

        // results are ordered, the first one carries the top score
        double topScore = retrieved.get(0).score();
        double effectiveMinScore = computeDynamicMinScore(requestedMinScore, topScore);

        List<RetrievedResult> filtered = retrieved.stream()
                .filter(r -> r.score() >= effectiveMinScore)
                .toList();

        // Safety net: keep at least the single best chunk.
        if (filtered.isEmpty()) {
            log.debug("Retrieval: all chunks filtered out (topScore={}, effectiveMinScore={}), keeping best",
                    topScore, effectiveMinScore);
            filtered = List.of(retrieved.get(0));
        }

        return new RagRetrievalResult(question, filtered, buildContext(filtered));
    }

    /**
     * Compute a dynamic minimum score from the requested one and the actual top score.
     *  - topScore >= requested: keep results within margin of the top, never below requested
     *  - topScore < requested: relax to topScore - margin, never below the absolute floor
     * The result never exceeds topScore.
     */
    static double computeDynamicMinScore(double requestedMinScore, double topScore) {
        double fromTop = topScore - TOP_SCORE_MARGIN;
        double dynamicMinScore = topScore >= requestedMinScore
                ? Math.max(requestedMinScore, fromTop)
                : Math.max(ABSOLUTE_FLOOR_SCORE, fromTop);
        return Math.min(dynamicMinScore, topScore);
    }

    /**
     * Context block per chunk:
     *   [source=file.txt, chunk=doc#3, score=0.873]
     *   chunk text...
     */
    public String buildContext(List<RetrievedResult> results) {
        if (results == null || results.isEmpty()) {
            return "(no results)";
        }
        return results.stream()
                .map(r -> "[source=" + r.chunk().filename()
                        + ", chunk=" + r.chunk().id()
                        + ", score=" + String.format(Locale.US, "%.3f", r.score())
                        + "]\n"
                        + r.chunk().text())
                .collect(Collectors.joining("\n\n"));
    }
}
