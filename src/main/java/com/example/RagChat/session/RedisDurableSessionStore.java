package com.example.RagChat.session;

import com.example.RagChat.exception.DurableStoreException;
import com.example.RagChat.model.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Sessions stored as one JSON string per user with a native Redis TTL.
 * Writes use WATCH/MULTI/EXEC so two processes appending to the same user never lose an update.
 */
@RequiredArgsConstructor
public class RedisDurableSessionStore implements DurableSessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDurableSessionStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Session> load(String userId) {
        String raw;
        try {
            raw = redisTemplate.opsForValue().get(DurableSessionStore.keyOf(userId));
        } catch (DataAccessException e) {
            throw new DurableStoreException("Redis read failed for user " + userId, e);
        }
        return Optional.ofNullable(raw).flatMap(value -> parse(userId, value));
    }

    @Override
    public boolean compareAndSet(String userId, long expectedVersion, Session session, Duration ttl) {
        String key = DurableSessionStore.keyOf(userId);
        String json = write(session);
        try {
            Boolean applied = redisTemplate.execute(new SessionCallback<Boolean>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> Boolean execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    String current = ops.opsForValue().get(key);
                    long currentVersion = current == null
                            ? 0L
                            : parse(userId, current).map(Session::version).orElse(0L);
                    if (currentVersion != expectedVersion) {
                        ops.unwatch();
                        return false;
                    }
                    ops.multi();
                    ops.opsForValue().set(key, json, ttl);
                    List<Object> results = ops.exec();
                    // an aborted transaction returns no replies
                    return results != null && !results.isEmpty();
                }
            });
            return Boolean.TRUE.equals(applied);
        } catch (DataAccessException e) {
            throw new DurableStoreException("Redis write failed for user " + userId, e);
        }
    }

    @Override
    public void delete(String userId) {
        try {
            redisTemplate.delete(DurableSessionStore.keyOf(userId));
        } catch (DataAccessException e) {
            throw new DurableStoreException("Redis delete failed for user " + userId, e);
        }
    }

    private Optional<Session> parse(String userId, String raw) {
        try {
            return Optional.of(objectMapper.readValue(raw, Session.class));
        } catch (JsonProcessingException e) {
            // a corrupt record is treated as absent and overwritten by the next write
            log.warn("Discarding unreadable session record for user {}", userId, e);
            return Optional.empty();
        }
    }

    private String write(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session is not serializable", e);
        }
    }
}
