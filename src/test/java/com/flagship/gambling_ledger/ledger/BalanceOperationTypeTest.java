package com.flagship.gambling_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BalanceOperationTypeTest {

    @Test
    @DisplayName("Every operation is either a credit or a debit")
    void everyOperationHasASign() {
        for (BalanceOperationType type : BalanceOperationType.values()) {
            assertNotEquals(type.isCredit(), type.isDebit(), type.name());
        }
    }

    @Test
    @DisplayName("Only correction kinds may drive a balance negative")
    void onlyCorrectionsMayGoNegative() {
        Set<BalanceOperationType> mayGoNegative = EnumSet.noneOf(BalanceOperationType.class);
        for (BalanceOperationType type : BalanceOperationType.values()) {
            if (type.mayGoNegative()) {
                mayGoNegative.add(type);
                assertTrue(type.isDebit(), type.name());
            }
        }
        assertEquals(EnumSet.of(BalanceOperationType.WIN_CANCEL,
                BalanceOperationType.CORRECTION_DEBIT,
                BalanceOperationType.CORRECTION_BUYIN), mayGoNegative);
    }

    @Test
    @DisplayName("signed() applies the operation's sign to an unsigned amount")
    void signed() {
        BigDecimal amount = new BigDecimal("12.5");
        assertEquals(new BigDecimal("12.5"), BalanceOperationType.DEPOSIT.signed(amount));
        assertEquals(new BigDecimal("-12.5"), BalanceOperationType.BET.signed(amount));
        assertEquals(new BigDecimal("-12.5"), BalanceOperationType.WIN_CANCEL.signed(amount));
    }

    @Test
    @DisplayName("Zero amounts are reserved for bets")
    void zeroAmountOnlyForBets() {
        for (BalanceOperationType type : BalanceOperationType.values()) {
            assertEquals(type == BalanceOperationType.BET, type.allowsZeroAmount(), type.name());
        }
    }

    @Test
    @DisplayName("Asset codes parse case-insensitively and reject unknown codes")
    void assetParsing() {
        assertEquals(Asset.BTC, Asset.parse("btc"));
        assertEquals(Asset.USDT, Asset.parse(" USDT "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Asset.parse("EUR"));
        assertTrue(e.getMessage().contains("Unsupported asset"));
        assertThrows(IllegalArgumentException.class, () -> Asset.parse(""));
    }
}
