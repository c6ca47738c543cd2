package com.flagship.gambling_ledger.lock;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry behaviour for lock acquisition.
 */
@Value
@Builder(toBuilder = true)
public class LockOptions {

    /** Attempts after the first one. Zero means a single try. */
    int retryCount;

    Duration retryDelay;

    /** Upper bound of the random delay added to retryDelay. */
    Duration jitter;

    public static LockOptions noRetry() {
        return LockOptions.builder()
                .retryCount(0)
                .retryDelay(Duration.ZERO)
                .jitter(Duration.ZERO)
                .build();
    }

    Duration nextDelay() {
        long jitterMs = jitter == null ? 0 : jitter.toMillis();
        long extra = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0;
        return retryDelay.plusMillis(extra);
    }

    /**
     * Worst-case time spent waiting between attempts.
     */
    public Duration maxWait() {
        long jitterMs = jitter == null ? 0 : jitter.toMillis();
        return retryDelay.plusMillis(jitterMs).multipliedBy(retryCount);
    }
}
