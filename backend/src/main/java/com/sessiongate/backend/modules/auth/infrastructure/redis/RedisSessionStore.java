package com.sessiongate.backend.modules.auth.infrastructure.redis;

import java.util.Optional;
import java.util.function.Consumer;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Stores markers as {@code session:<user_id> -> <user_id>} with no expiry.
 */
@Component
public class RedisSessionStore implements SessionStore {

    static final String KEY_PREFIX = "session:";
    static final long SCAN_PAGE_SIZE = 1000;

    private final StringRedisTemplate redisTemplate;

    public RedisSessionStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void putMarker(String userId) {
        try {
            redisTemplate.opsForValue().set(key(userId), userId);
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException("Failed to write session marker", ex);
        }
    }

    @Override
    public Optional<String> findMarker(String userId) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key(userId)));
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException("Failed to read session marker", ex);
        }
    }

    @Override
    public boolean deleteMarker(String userId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key(userId)));
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException("Failed to delete session marker", ex);
        }
    }

    @Override
    public void scanMarkers(Consumer<String> action) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(KEY_PREFIX + "*")
                .count(SCAN_PAGE_SIZE)
                .build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                action.accept(cursor.next().substring(KEY_PREFIX.length()));
            }
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException("Failed to scan session markers", ex);
        }
    }

    private static String key(String userId) {
        return KEY_PREFIX + userId;
    }
}
