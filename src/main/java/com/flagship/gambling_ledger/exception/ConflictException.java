package com.flagship.gambling_ledger.exception;

/**
 * The request is valid but clashes with existing state, for example a
 * second active wager limit or an operation id already used for a
 * different operation.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
