package com.example.musicstreaming.infrastructure.lock;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

/**
 * Build lock stored in Redis with {@code SET NX EX}. When Redis is unreachable the lock degrades to
 * process-local coordination: acquiring succeeds and no remote holder is reported.
 */
public class RedisDashBuildLock implements DashBuildLock {

    private static final Logger log = LoggerFactory.getLogger(RedisDashBuildLock.class);

    static final String KEY_PREFIX = "streaming:dash-build-lock:v1:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisDashBuildLock(StringRedisTemplate redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public String tryAcquire(String cacheKey) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + cacheKey, token, ttl);
            return Boolean.TRUE.equals(acquired) ? token : null;
        } catch (RuntimeException e) {
            log.warn("DASH_BUILD_LOCK_UNAVAILABLE op=acquire cacheKey={} error={}", cacheKey, e.getMessage());
            return token;
        }
    }

    @Override
    public void release(String cacheKey, String token) {
        if (token == null) {
            return;
        }
        try {
            redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(KEY_PREFIX + cacheKey), token);
        } catch (RuntimeException e) {
            log.warn("DASH_BUILD_LOCK_UNAVAILABLE op=release cacheKey={} error={}", cacheKey, e.getMessage());
        }
    }

    @Override
    public boolean isHeld(String cacheKey) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + cacheKey));
        } catch (RuntimeException e) {
            log.warn("DASH_BUILD_LOCK_UNAVAILABLE op=exists cacheKey={} error={}", cacheKey, e.getMessage());
            return false;
        }
    }
}
