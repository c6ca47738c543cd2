package com.flagship.gambling_ledger.guard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window request counter shared by every worker through Redis.
 *
 * INCR and the first PEXPIRE run in one script, so a counter can never be
 * left without a TTL. When Redis is unreachable the limiter lets requests
 * through; the balance lock will refuse them anyway.
 */
@Component
@Slf4j
public class RateLimiter {

    static final String KEY_PREFIX = "ratelimit:";

    private static final DefaultRedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
        "local count = redis.call('incr', KEYS[1]) " +
        "if count == 1 then redis.call('pexpire', KEYS[1], ARGV[1]) end " +
        "return count",
        Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final boolean enabled;

    public RateLimiter(StringRedisTemplate redisTemplate,
                       @Value("${guard.rate-limit.enabled:true}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
    }

    /**
     * Counts one request against the policy.
     *
     * @throws RateLimitExceededException when the window's permits are used up
     */
    public void acquire(UUID userId, GuardPolicy policy) {
        if (!enabled) {
            return;
        }
        String key = key(userId, policy);
        Long count;
        try {
            count = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key),
                String.valueOf(policy.getWindow().toMillis()));
        } catch (DataAccessException e) {
            log.warn("Rate limiter unavailable, allowing request: policy={}, error={}", policy.getName(), e.getMessage());
            return;
        }
        if (count == null || count <= policy.getPermits()) {
            return;
        }

        log.warn("Rate limit exceeded: policy={}, userId={}, count={}, permits={}",
            policy.getName(), userId, count, policy.getPermits());
        throw new RateLimitExceededException(policy.getName(), retryAfterSeconds(key, policy));
    }

    /**
     * Seconds until the window resets, rounded up. Falls back to the full
     * window when the TTL cannot be read.
     */
    private long retryAfterSeconds(String key, GuardPolicy policy) {
        long ttlMs;
        try {
            Long expire = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            ttlMs = expire == null || expire < 0 ? policy.getWindow().toMillis() : expire;
        } catch (DataAccessException e) {
            ttlMs = policy.getWindow().toMillis();
        }
        return Math.max(1, (ttlMs + 999) / 1000);
    }

    public long currentCount(UUID userId, GuardPolicy policy) {
        String value = redisTemplate.opsForValue().get(key(userId, policy));
        return value == null ? 0 : Long.parseLong(value);
    }

    static String key(UUID userId, GuardPolicy policy) {
        return KEY_PREFIX + policy.getName() + ":" + userId;
    }
}
