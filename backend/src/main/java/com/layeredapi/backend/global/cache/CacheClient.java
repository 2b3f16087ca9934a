package com.layeredapi.backend.global.cache;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Plain key-value access to Redis. Best-effort: when disabled or unreachable every call logs and degrades
 * to a miss or no-op instead of failing the request.
 */
@Component
public class CacheClient {

    private static final Logger log = LoggerFactory.getLogger(CacheClient.class);

    private final StringRedisTemplate redisTemplate;

    public CacheClient(CacheProperties properties, ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        this.redisTemplate = properties.enabled() ? redisTemplateProvider.getIfAvailable() : null;
    }

    public boolean isEnabled() {
        return redisTemplate != null;
    }

    public void set(String key, String value, Duration ttl) {
        if (!isEnabled()) {
            return;
        }
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redisTemplate.opsForValue().set(key, value);
            } else {
                redisTemplate.opsForValue().set(key, value, ttl);
            }
        } catch (DataAccessException ex) {
            log.warn("Redis SET {} failed: {}", key, ex.getMessage());
        }
    }

    public Optional<String> get(String key) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException ex) {
            log.warn("Redis GET {} failed: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return number of keys removed; 0 when disabled or unreachable
     */
    public long delete(String... keys) {
        if (!isEnabled() || keys.length == 0) {
            return 0L;
        }
        try {
            Long removed = redisTemplate.delete(Arrays.asList(keys));
            return removed != null ? removed : 0L;
        } catch (DataAccessException ex) {
            log.warn("Redis DEL {} failed: {}", Arrays.toString(keys), ex.getMessage());
            return 0L;
        }
    }

    public boolean exists(String key) {
        if (!isEnabled()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (DataAccessException ex) {
            log.warn("Redis EXISTS {} failed: {}", key, ex.getMessage());
            return false;
        }
    }

    /**
     * @return true when Redis answered PING; false when disabled or unreachable
     */
    public boolean ping() {
        if (!isEnabled()) {
            return false;
        }
        try {
            String reply = redisTemplate.execute(connection -> connection.ping(), true);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException ex) {
            log.warn("Redis ping failed: {}", ex.getMessage());
            return false;
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkConnection() {
        if (!isEnabled()) {
            log.info("Redis cache disabled");
            return;
        }
        if (ping()) {
            log.info("Redis connected successfully");
        } else {
            log.warn("Redis is unreachable, continuing without cache");
        }
    }
}
