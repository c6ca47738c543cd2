package com.flagship.gambling_ledger.lock;

import lombok.Value;

import java.time.Instant;

/**
 * A granted lock on a named resource.
 *
 * The token is the fencing value stored under the key. Release and extend
 * only succeed while the stored value still equals this token, so a holder
 * whose lock expired and was re-granted elsewhere cannot touch the new grant.
 */
@Value
public class Lock {
    String resource;
    String key;
    String token;
    Instant acquiredAt;
    Instant expiresAt;

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }
}
