package com.flagship.gambling_ledger.lock;

import com.flagship.gambling_ledger.observability.LockMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cluster-wide mutual exclusion on named resources, backed by Redis.
 *
 * Acquisition is a single SET NX PX, so the key either belongs to exactly one
 * holder or to nobody. Every grant carries a random token; release and extend
 * run as Lua scripts that compare the stored token before touching the key.
 * The TTL bounds how long a crashed worker can block a resource.
 *
 * Redis is not the source of truth for anything guarded here. The lock only
 * narrows the read-modify-write window; the database constraints still hold
 * if a lock expires mid-operation.
 */
@Service
@Slf4j
public class LockCoordinator {

    static final String KEY_PREFIX = "locks:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private static final DefaultRedisScript<Long> EXTEND_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final LockMetrics lockMetrics;
    private final Duration defaultTtl;
    private final LockOptions defaultOptions;

    public LockCoordinator(StringRedisTemplate redisTemplate,
                           LockMetrics lockMetrics,
                           @Value("${lock.ttl-ms:10000}") long ttlMs,
                           @Value("${lock.retry-count:3}") int retryCount,
                           @Value("${lock.retry-delay-ms:200}") long retryDelayMs,
                           @Value("${lock.jitter-ms:100}") long jitterMs) {
        this.redisTemplate = redisTemplate;
        this.lockMetrics = lockMetrics;
        this.defaultTtl = Duration.ofMillis(ttlMs);
        this.defaultOptions = LockOptions.builder()
                .retryCount(retryCount)
                .retryDelay(Duration.ofMillis(retryDelayMs))
                .jitter(Duration.ofMillis(jitterMs))
                .build();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public LockOptions getDefaultOptions() {
        return defaultOptions;
    }

    public Lock acquire(String resource) {
        return acquire(resource, defaultTtl, defaultOptions);
    }

    /**
     * Acquires the lock, retrying on contention.
     *
     * @throws LockTimeoutException if every attempt found the resource held
     */
    public Lock acquire(String resource, Duration ttl, LockOptions options) {
        LockKeys.validate(resource);
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Lock TTL must be positive");
        }

        String key = KEY_PREFIX + resource;
        String token = UUID.randomUUID().toString();
        int attempts = options.getRetryCount() + 1;
        Timer.Sample waitSample = lockMetrics.startWait();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                Instant now = Instant.now();
                lockMetrics.recordAcquired(waitSample);
                log.debug("Acquired lock: resource={}, attempt={}, ttl={}ms", resource, attempt, ttl.toMillis());
                return new Lock(resource, key, token, now, now.plus(ttl));
            }

            lockMetrics.recordContention();
            if (attempt < attempts) {
                try {
                    Thread.sleep(options.nextDelay().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lockMetrics.recordTimeout(waitSample);
                    throw new LockTimeoutException(resource, attempt, e);
                }
            }
        }

        lockMetrics.recordTimeout(waitSample);
        log.warn("Lock acquisition timed out: resource={}, attempts={}", resource, attempts);
        throw new LockTimeoutException(resource, attempts);
    }

    /**
     * Single attempt, no retries. Empty when the resource is held.
     */
    public Optional<Lock> tryLock(String resource, Duration ttl) {
        try {
            return Optional.of(acquire(resource, ttl, LockOptions.noRetry()));
        } catch (LockTimeoutException e) {
            return Optional.empty();
        }
    }

    /**
     * Releases the lock if this grant still owns it.
     *
     * Never throws: a lock that already expired, or that Redis cannot be
     * reached to delete, will disappear on its own when the TTL runs out.
     *
     * @return true if the key was deleted by this call
     */
    public boolean release(Lock lock) {
        if (lock == null) {
            return false;
        }
        lockMetrics.recordHeld(Duration.between(lock.getAcquiredAt(), Instant.now()));
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(lock.getKey()), lock.getToken());
            boolean released = deleted != null && deleted > 0;
            if (released) {
                log.debug("Released lock: resource={}", lock.getResource());
            } else {
                log.warn("Lock {} was no longer held by this owner at release (expired at {})",
                        lock.getResource(), lock.getExpiresAt());
            }
            return released;
        } catch (DataAccessException e) {
            log.error("Failed to release lock {}, it will expire at {}: {}",
                    lock.getResource(), lock.getExpiresAt(), e.getMessage());
            return false;
        }
    }

    /**
     * Pushes the expiry of a held lock forward.
     *
     * @return false if the lock was lost in the meantime
     */
    public boolean extend(Lock lock, Duration ttl) {
        Long result = redisTemplate.execute(EXTEND_SCRIPT, List.of(lock.getKey()),
                lock.getToken(), String.valueOf(ttl.toMillis()));
        boolean extended = result != null && result > 0;
        if (!extended) {
            log.warn("Could not extend lock {}: no longer owned", lock.getResource());
        }
        return extended;
    }

    public boolean isLocked(String resource) {
        LockKeys.validate(resource);
        return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + resource));
    }

    public <T> T withLock(String resource, Supplier<T> action) {
        return withLock(resource, defaultTtl, action, defaultOptions);
    }

    /**
     * Runs the action while holding the lock. The lock is released on every
     * exit path, including exceptions thrown by the action.
     */
    public <T> T withLock(String resource, Duration ttl, Supplier<T> action, LockOptions options) {
        Lock lock = acquire(resource, ttl, options);
        try {
            return action.get();
        } finally {
            release(lock);
        }
    }

    public void withLock(String resource, Runnable action) {
        withLock(resource, () -> {
            action.run();
            return null;
        });
    }
}
