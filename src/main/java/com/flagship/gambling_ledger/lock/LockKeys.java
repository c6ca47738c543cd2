package com.flagship.gambling_ledger.lock;

import java.util.UUID;

/**
 * Builds and validates lock resource names.
 *
 * A resource name is a colon separated list of non-blank segments. Segments
 * may not contain colons or whitespace, which keeps the Redis key space for
 * different resource kinds disjoint.
 */
public final class LockKeys {

    public static final String EXPIRY_SCHEDULER = "scheduler:self-exclusion-expiry";

    private LockKeys() {
    }

    /**
     * Lock guarding the read-modify-write window of one balance row.
     */
    public static String balance(UUID userId, String asset) {
        return of("balance", userId, asset);
    }

    /**
     * Lock serializing exclusion and limit mutations of one user.
     */
    public static String selfExclusion(UUID userId) {
        return of("self-exclusion", userId);
    }

    public static String of(String prefix, Object... parts) {
        StringBuilder resource = new StringBuilder(segment(prefix));
        for (Object part : parts) {
            resource.append(':').append(segment(part));
        }
        return resource.toString();
    }

    public static void validate(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Lock resource cannot be null or blank");
        }
        for (String part : resource.split(":", -1)) {
            if (part.isEmpty() || containsWhitespace(part)) {
                throw new IllegalArgumentException("Invalid lock resource: '" + resource + "'");
            }
        }
    }

    private static String segment(Object part) {
        if (part == null) {
            throw new IllegalArgumentException("Lock key segment cannot be null");
        }
        String value = part.toString();
        if (value.isBlank() || value.indexOf(':') >= 0 || containsWhitespace(value)) {
            throw new IllegalArgumentException("Invalid lock key segment: '" + value + "'");
        }
        return value;
    }

    private static boolean containsWhitespace(String value) {
        return value.chars().anyMatch(Character::isWhitespace);
    }
}
