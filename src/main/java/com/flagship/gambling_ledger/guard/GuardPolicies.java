package com.flagship.gambling_ledger.guard;

import com.flagship.gambling_ledger.exclusion.GuardedAction;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public final class GuardPolicies {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    public static final GuardPolicy BET = policy("bet", GuardedAction.BET, 120);
    public static final GuardPolicy DEPOSIT = policy("deposit", GuardedAction.DEPOSIT, 10);
    public static final GuardPolicy BONUS = policy("bonus", GuardedAction.BONUS, 10);
    public static final GuardPolicy LOGIN = policy("login", GuardedAction.LOGIN, 10);
    public static final GuardPolicy TOKEN_REFRESH = policy("token-refresh", GuardedAction.TOKEN_REFRESH, 30);

    public static final GuardPolicy LEDGER_WRITE = policy("ledger-write", null, 600);
    public static final GuardPolicy SELF_EXCLUSION_WRITE = policy("self-exclusion-write", null, 10);

    private static final Map<GuardedAction, GuardPolicy> BY_ACTION = Map.of(
        GuardedAction.BET, BET,
        GuardedAction.DEPOSIT, DEPOSIT,
        GuardedAction.BONUS, BONUS,
        GuardedAction.LOGIN, LOGIN,
        GuardedAction.TOKEN_REFRESH, TOKEN_REFRESH
    );

    private GuardPolicies() {
    }

    /**
     * Resolves a path value such as "token-refresh" or "BET" to its policy.
     *
     * @throws IllegalArgumentException for an unknown action
     */
    public static GuardPolicy forAction(String action) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action is required");
        }
        GuardedAction parsed;
        try {
            parsed = GuardedAction.valueOf(action.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + action);
        }
        return BY_ACTION.get(parsed);
    }

    private static GuardPolicy policy(String name, GuardedAction action, int permitsPerMinute) {
        return GuardPolicy.builder()
            .name(name)
            .action(action)
            .permits(permitsPerMinute)
            .window(MINUTE)
            .build();
    }
}
