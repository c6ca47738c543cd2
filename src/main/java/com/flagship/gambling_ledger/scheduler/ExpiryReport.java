package com.flagship.gambling_ledger.scheduler;

import lombok.Value;

/**
 * Rows touched by one expiry pass.
 */
@Value
public class ExpiryReport {
    int windowsOpened;
    int cooldownsRemoved;
    int temporaryExclusionsExpired;
    int limitsRemoved;

    public int total() {
        return windowsOpened + cooldownsRemoved + temporaryExclusionsExpired + limitsRemoved;
    }
}
