package com.example.RagChat.session;

import com.example.RagChat.exception.DurableStoreException;
import com.example.RagChat.model.Message;
import com.example.RagChat.model.Session;
import com.example.RagChat.model.SessionEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisDurableSessionStoreTest {

    private static final String KEY = "session:alice";
    private static final Duration TTL = Duration.ofHours(1);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private RedisOperations<String, String> transaction;

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final Instant now = Instant.parse("2026-01-01T10:00:00Z");

    private RedisDurableSessionStore store;

    @BeforeEach
    void setUp() {
        store = new RedisDurableSessionStore(redisTemplate, objectMapper);
    }

    private Session session(long version) {
        return Session.create("alice", now, TTL)
                .append(List.of(Message.user("What is RAG?", now, false),
                        Message.assistant("Retrieval augmented generation.", now, List.of("rag#0"), false)), now)
                .withEvent(new SessionEvent("input_blocked", "message contains blocked content", now), now)
                .withVersion(version);
    }

    @SuppressWarnings("unchecked")
    private void runCallbacksAgainstTransaction() {
        when(redisTemplate.execute(any(SessionCallback.class)))
                .thenAnswer(inv -> inv.getArgument(0, SessionCallback.class).execute(transaction));
        when(transaction.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void loadReadsTheJsonRecord() throws Exception {
        Session stored = session(3);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn(objectMapper.writeValueAsString(stored));

        Session loaded = store.load("alice").orElseThrow();

        assertEquals(stored, loaded);
        assertEquals(3, loaded.version());
        assertEquals(List.of("rag#0"), loaded.messages().get(1).sources());
    }

    @Test
    void missingKeyLoadsAsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        assertEquals(Optional.empty(), store.load("alice"));
    }

    @Test
    void unreadableRecordLoadsAsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn("{not json");

        assertEquals(Optional.empty(), store.load("alice"));
    }

    @Test
    void readFailureBecomesDurableStoreException() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThrows(DurableStoreException.class, () -> store.load("alice"));
    }

    @Test
    void compareAndSetWritesWhenVersionMatches() throws Exception {
        runCallbacksAgainstTransaction();
        when(valueOperations.get(KEY)).thenReturn(objectMapper.writeValueAsString(session(1)));
        when(transaction.exec()).thenReturn(List.of(true));

        assertTrue(store.compareAndSet("alice", 1, session(2), TTL));

        ArgumentCaptor<String> written = ArgumentCaptor.forClass(String.class);
        verify(transaction).watch(KEY);
        verify(transaction).multi();
        verify(valueOperations).set(eq(KEY), written.capture(), eq(TTL));
        assertEquals(2, objectMapper.readValue(written.getValue(), Session.class).version());
    }

    @Test
    void compareAndSetOnAbsentKeyExpectsVersionZero() {
        runCallbacksAgainstTransaction();
        when(transaction.exec()).thenReturn(List.of(true));

        assertTrue(store.compareAndSet("alice", 0, session(1), TTL));
    }

    @Test
    void versionMismatchIsRejectedWithoutWriting() throws Exception {
        runCallbacksAgainstTransaction();
        when(valueOperations.get(KEY)).thenReturn(objectMapper.writeValueAsString(session(5)));

        assertFalse(store.compareAndSet("alice", 4, session(5), TTL));

        verify(transaction).unwatch();
        verify(transaction, never()).multi();
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void abortedTransactionReportsConflict() {
        runCallbacksAgainstTransaction();
        when(transaction.exec()).thenReturn(List.of());

        assertFalse(store.compareAndSet("alice", 0, session(1), TTL));
    }

    @Test
    void nullExecReplyReportsConflict() {
        runCallbacksAgainstTransaction();
        when(transaction.exec()).thenReturn(null);

        assertFalse(store.compareAndSet("alice", 0, session(1), TTL));
    }

    @Test
    @SuppressWarnings("unchecked")
    void writeFailureBecomesDurableStoreException() {
        when(redisTemplate.execute(any(SessionCallback.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThrows(DurableStoreException.class, () -> store.compareAndSet("alice", 0, session(1), TTL));
    }

    @Test
    void deleteFailureBecomesDurableStoreException() {
        when(redisTemplate.delete(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThrows(DurableStoreException.class, () -> store.delete("alice"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingReportsReachability() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenReturn("PONG")
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertTrue(store.ping());
        assertFalse(store.ping());
    }
}
