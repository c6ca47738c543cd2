package com.flagship.gambling_ledger.guard;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String policy;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String policy, long retryAfterSeconds) {
        super("Too many requests. Please try again in " + retryAfterSeconds + " seconds.");
        this.policy = policy;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
