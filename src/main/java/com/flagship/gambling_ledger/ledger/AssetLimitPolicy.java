package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.config.LedgerProperties;
import com.flagship.gambling_ledger.limits.LimitExceededException;
import com.flagship.gambling_ledger.limits.LimitKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Shape and size checks on a balance update that need no lock:
 * amount sign, precision and ceiling, and the per-asset deposit/withdraw
 * bounds.
 * The daily withdrawal cap reads history and runs under the lock.
 */
@Component
@RequiredArgsConstructor
public class AssetLimitPolicy {

    private static final int MAX_OPERATION_ID_LENGTH = 255;

    private final LedgerProperties properties;
    private final BalanceOperationRepository operationRepository;

    public void validate(BalanceUpdate update) {
        if (update.getOperation() == null) {
            throw new IllegalArgumentException("Operation type is required");
        }
        if (update.getOperationId() == null || update.getOperationId().isBlank()) {
            throw new IllegalArgumentException("Operation ID cannot be null or blank");
        }
        if (update.getOperationId().length() > MAX_OPERATION_ID_LENGTH) {
            throw new IllegalArgumentException("Operation ID cannot exceed " + MAX_OPERATION_ID_LENGTH + " characters");
        }
        if (update.getUserId() == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (update.getAsset() == null) {
            throw new IllegalArgumentException("Asset is required");
        }

        BigDecimal amount = update.getAmount();
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (amount.signum() == 0 && !update.getOperation().allowsZeroAmount()) {
            throw new IllegalArgumentException("Amount must be greater than 0 for " + update.getOperation());
        }
        if (amount.stripTrailingZeros().scale() > Asset.MAX_SCALE) {
            throw new IllegalArgumentException("Amount cannot have more than " + Asset.MAX_SCALE + " decimal places");
        }
        if (amount.compareTo(maxBalance()) > 0) {
            throw new IllegalArgumentException("Amount cannot exceed " + maxBalance().toPlainString());
        }

        LedgerProperties.AssetSettings settings = properties.forAsset(update.getAsset());
        switch (update.getOperation()) {
            case DEPOSIT -> checkBounds("Deposit", update, settings.getMinDeposit(), settings.getMaxDeposit());
            case WITHDRAW -> checkBounds("Withdrawal", update, settings.getMinWithdraw(), settings.getMaxWithdraw());
            default -> {
            }
        }
    }

    /**
     * Rejects a withdrawal that would take today's (UTC) total past the cap.
     */
    public void checkDailyWithdrawal(BalanceUpdate update) {
        if (update.getOperation() != BalanceOperationType.WITHDRAW) {
            return;
        }
        BigDecimal cap = properties.forAsset(update.getAsset()).getDailyWithdrawLimit();
        if (cap == null) {
            return;
        }
        Instant startOfDay = LocalDate.now(ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
        BigDecimal withdrawnToday = operationRepository.sumAmountSince(
            update.getUserId(), update.getAsset(), BalanceOperationType.WITHDRAW, startOfDay);

        if (withdrawnToday.add(update.getAmount()).compareTo(cap) > 0) {
            BigDecimal remaining = cap.subtract(withdrawnToday).max(BigDecimal.ZERO);
            throw new LimitExceededException(LimitKind.DAILY_WITHDRAW, null,
                String.format("Daily withdrawal limit of %s %s exceeded. You can withdraw %s %s more today.",
                    cap.toPlainString(), update.getAsset(), remaining.toPlainString(), update.getAsset()));
        }
    }

    public BigDecimal maxBalance() {
        return properties.getMaxBalance();
    }

    public BigDecimal referenceRate(Asset asset) {
        return properties.forAsset(asset).getReferenceRate();
    }

    private void checkBounds(String label, BalanceUpdate update, BigDecimal min, BigDecimal max) {
        BigDecimal amount = update.getAmount();
        if (min != null && amount.compareTo(min) < 0) {
            throw new IllegalArgumentException(String.format("%s amount must be at least %s %s",
                label, min.toPlainString(), update.getAsset()));
        }
        if (max != null && amount.compareTo(max) > 0) {
            throw new IllegalArgumentException(String.format("%s amount cannot exceed %s %s",
                label, max.toPlainString(), update.getAsset()));
        }
    }
}
