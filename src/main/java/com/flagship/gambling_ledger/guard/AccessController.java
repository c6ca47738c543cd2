package com.flagship.gambling_ledger.guard;

import com.flagship.gambling_ledger.config.LedgerProperties;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.limits.MinorUnits;
import com.flagship.gambling_ledger.limits.PeriodicLimitEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Pre-flight check for the login, session, bonus, deposit and betting
 * collaborators. 204 when the action may proceed; otherwise the error
 * response of the refusal (403, 422 or 429). Amounts are in the limit
 * currency and may not exceed the balance ceiling.
 */
@RestController
@RequestMapping("/users/access")
@RequiredArgsConstructor
public class AccessController {

    private final PolicyGuard policyGuard;
    private final PeriodicLimitEvaluator limitEvaluator;
    private final LedgerProperties ledgerProperties;

    @GetMapping("/{action}")
    public ResponseEntity<Void> check(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable("action") String action,
            @RequestParam(name = "platformType", required = false) PlatformType platformType,
            @RequestParam(name = "amount", required = false) BigDecimal amount) {

        GuardPolicy policy = GuardPolicies.forAction(action);
        if (amount != null && amount.compareTo(ledgerProperties.getMaxBalance()) > 0) {
            throw new IllegalArgumentException("Amount cannot exceed " + ledgerProperties.getMaxBalance().toPlainString());
        }
        policyGuard.enforce(userId, policy, platformType);

        if (amount != null && amount.signum() > 0) {
            switch (policy.getAction()) {
                case DEPOSIT -> limitEvaluator.checkDeposit(userId, MinorUnits.toCents(amount), platformType);
                case BET -> limitEvaluator.checkBet(userId, MinorUnits.toCents(amount), platformType);
                default -> {
                }
            }
        }
        return ResponseEntity.noContent().build();
    }
}
