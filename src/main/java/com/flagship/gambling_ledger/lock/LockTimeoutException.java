package com.flagship.gambling_ledger.lock;

import lombok.Getter;

/**
 * Thrown when a lock could not be acquired within the configured retries.
 * Transient: callers may retry the whole operation.
 */
@Getter
public class LockTimeoutException extends RuntimeException {

    public static final String USER_MESSAGE = "The system is currently busy. Please try again in a moment.";

    private final String resource;
    private final int attempts;

    public LockTimeoutException(String resource, int attempts) {
        super(String.format("Could not acquire lock on %s after %d attempt(s)", resource, attempts));
        this.resource = resource;
        this.attempts = attempts;
    }

    public LockTimeoutException(String resource, int attempts, Throwable cause) {
        super(String.format("Interrupted while acquiring lock on %s after %d attempt(s)", resource, attempts), cause);
        this.resource = resource;
        this.attempts = attempts;
    }
}
