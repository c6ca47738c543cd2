package com.flagship.gambling_ledger.ledger;

/**
 * Status stored with an applied operation. Rejected operations are never
 * persisted, so only confirmed rows exist today.
 */
public enum OperationStatus {
    CONFIRMED
}
