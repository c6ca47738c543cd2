package com.flagship.gambling_ledger.exclusion;

/**
 * User actions an access exclusion can block.
 *
 * Login and session refresh stay open under every restriction except a
 * platform-wide permanent exclusion, so a restricted user can still sign in
 * and withdraw.
 */
public enum GuardedAction {
    BET("Betting"),
    DEPOSIT("Depositing"),
    BONUS("Claiming bonuses"),
    LOGIN("Logging in"),
    TOKEN_REFRESH("Refreshing your session");

    private final String displayName;

    GuardedAction(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isSessionAction() {
        return this == LOGIN || this == TOKEN_REFRESH;
    }
}
