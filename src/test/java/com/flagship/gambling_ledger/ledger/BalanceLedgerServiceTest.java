package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.IntegrationTestSupport;
import com.flagship.gambling_ledger.exception.ConflictException;
import com.flagship.gambling_ledger.limits.LimitExceededException;
import com.flagship.gambling_ledger.limits.LimitKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the balance ledger: replays, key collisions, overdrafts
 * and concurrent writers.
 */
@SpringBootTest
class BalanceLedgerServiceTest extends IntegrationTestSupport {

    @Autowired
    private BalanceLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
    }

    private BalanceUpdate update(BalanceOperationType type, String amount, Asset asset) {
        return update(type, "op-" + UUID.randomUUID(), amount, asset);
    }

    private BalanceUpdate update(BalanceOperationType type, String operationId, String amount, Asset asset) {
        return BalanceUpdate.builder()
                .operation(type)
                .operationId(operationId)
                .userId(userId)
                .amount(new BigDecimal(amount))
                .asset(asset)
                .description("test " + type)
                .build();
    }

    private int operationRows(String operationId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM balance_operations WHERE operation_id = ?", Integer.class, operationId);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Deposit then bet moves the balance and records both operations")
    void depositThenBet() {
        printTestHeader("Deposit then bet");

        BalanceUpdateResult deposit = ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "100", Asset.USDT));
        BalanceUpdateResult bet = ledgerService.updateBalance(update(BalanceOperationType.BET, "25.5", Asset.USDT));

        printOutput("After deposit", deposit.getBalance());
        printOutput("After bet", bet.getBalance());
        assertTrue(deposit.isSuccess());
        assertFalse(deposit.isReplayed());
        assertEquals(0, new BigDecimal("100").compareTo(deposit.getBalance()));
        assertEquals(0, new BigDecimal("74.5").compareTo(bet.getBalance()));
        assertEquals(0, new BigDecimal("74.5").compareTo(ledgerService.getBalance(userId, Asset.USDT)));

        List<BalanceOperation> history = ledgerService.getHistory(userId, Asset.USDT, null, 20, 0);
        assertEquals(2, history.size());
        assertEquals(0, new BigDecimal("-25.5").compareTo(history.get(0).getSignedAmount()));
        assertEquals(0, new BigDecimal("100").compareTo(history.get(0).getPreviousBalance()));
        printSuccess("Balance and history consistent");
    }

    @Test
    @DisplayName("Replaying an operationId returns the stored result and changes nothing")
    void replayIsIdempotent() {
        printTestHeader("Idempotent replay");
        String operationId = "deposit-" + UUID.randomUUID();

        BalanceUpdateResult first = ledgerService.updateBalance(
                update(BalanceOperationType.DEPOSIT, operationId, "50", Asset.USDT));
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "10", Asset.USDT));
        BalanceUpdateResult replay = ledgerService.updateBalance(
                update(BalanceOperationType.DEPOSIT, operationId, "50", Asset.USDT));

        printInput("Operation ID", operationId);
        printOutput("Replayed", replay.isReplayed());
        printOutput("Replay balance", replay.getBalance());

        assertTrue(replay.isReplayed());
        assertEquals(first.getOperationId(), replay.getOperationId());
        assertEquals(0, first.getBalance().compareTo(replay.getBalance()),
                "Replay reports the balance right after the original operation");
        assertEquals(0, new BigDecimal("60").compareTo(ledgerService.getBalance(userId, Asset.USDT)));
        assertEquals(1, operationRows(operationId));
        printSuccess("Second call applied nothing");
    }

    @Test
    @DisplayName("Reusing an operationId for a different operation is a conflict")
    void reusedOperationIdConflicts() {
        printTestHeader("Operation id collision");
        String operationId = "collide-" + UUID.randomUUID();
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, operationId, "50", Asset.USDT));

        ConflictException e = assertThrows(ConflictException.class, () -> ledgerService.updateBalance(
                update(BalanceOperationType.DEPOSIT, operationId, "70", Asset.USDT)));
        printExpectedException("ConflictException", e.getMessage());
        assertTrue(e.getMessage().contains("different parameters"));
        assertEquals(0, new BigDecimal("50").compareTo(ledgerService.getBalance(userId, Asset.USDT)));
    }

    @Test
    @DisplayName("A debit larger than the balance is refused and leaves no trace")
    void insufficientBalance() {
        printTestHeader("Insufficient balance");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "20", Asset.USDT));
        BalanceUpdate bet = update(BalanceOperationType.BET, "20.01", Asset.USDT);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> ledgerService.updateBalance(bet));
        printExpectedException("InsufficientBalanceException", e.getMessage());

        assertEquals(0, new BigDecimal("20").compareTo(ledgerService.getBalance(userId, Asset.USDT)));
        assertEquals(0, operationRows(bet.getOperationId()));

        assertThrows(InsufficientBalanceException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.WITHDRAW, "5", Asset.USDC)));
        printSuccess("Nothing written for rejected debits");
    }

    @Test
    @DisplayName("Correction kinds may take the balance below zero")
    void correctionMayGoNegative() {
        printTestHeader("Negative correction");
        ledgerService.updateBalance(update(BalanceOperationType.WIN, "10", Asset.USDT));

        BalanceUpdateResult result = ledgerService.updateBalance(
                update(BalanceOperationType.WIN_CANCEL, "15", Asset.USDT));
        printOutput("Balance", result.getBalance());
        assertEquals(0, new BigDecimal("-5").compareTo(result.getBalance()));
        printSuccess("Win cancel recorded the overdraft");
    }

    @Test
    @DisplayName("A zero bet is recorded without changing the balance; zero deposits are rejected")
    void zeroAmounts() {
        printTestHeader("Zero amounts");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "5", Asset.USDT));

        BalanceUpdate demoBet = update(BalanceOperationType.BET, "0", Asset.USDT);
        BalanceUpdateResult result = ledgerService.updateBalance(demoBet);
        assertEquals(0, new BigDecimal("5").compareTo(result.getBalance()));
        assertEquals(1, operationRows(demoBet.getOperationId()));

        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "0", Asset.USDT)));
        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "-1", Asset.USDT)));
        printSuccess("Zero bet accepted, zero and negative deposits refused");
    }

    @Test
    @DisplayName("Per-asset bounds and precision are validated")
    void assetBounds() {
        printTestHeader("Asset bounds");
        IllegalArgumentException minDeposit = assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "0.5", Asset.USDT)));
        printExpectedException("IllegalArgumentException", minDeposit.getMessage());
        assertTrue(minDeposit.getMessage().contains("at least 1 USDT"));

        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "1.123456789", Asset.BTC)));

        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "20", Asset.BTC));
        IllegalArgumentException maxWithdraw = assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.WITHDRAW, "6", Asset.BTC)));
        assertTrue(maxWithdraw.getMessage().contains("cannot exceed 5 BTC"));
    }

    @Test
    @DisplayName("An amount past the balance ceiling is a bad request for every kind")
    void oversizedAmountRejected() {
        printTestHeader("Oversized amount");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "100", Asset.USDT));
        BalanceUpdate bet = update(BalanceOperationType.BET, "1E+17", Asset.USDT);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(bet));
        printExpectedException("IllegalArgumentException", e.getMessage());
        assertTrue(e.getMessage().contains("cannot exceed 999999999999"));
        assertEquals(0, operationRows(bet.getOperationId()));

        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.WIN_CANCEL, "1E+17", Asset.USDT)));
        assertEquals(0, new BigDecimal("100").compareTo(ledgerService.getBalance(userId, Asset.USDT)));
    }

    @Test
    @DisplayName("A batch whose second entry overdraws writes nothing")
    void batchIsAllOrNothing() {
        printTestHeader("Batch rollback");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "50", Asset.USDT));
        BalanceUpdate firstBet = update(BalanceOperationType.BET, "30", Asset.USDT);
        BalanceUpdate secondBet = update(BalanceOperationType.BET, "30", Asset.USDT);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> ledgerService.updateBalances(List.of(firstBet, secondBet)));
        printExpectedException("InsufficientBalanceException", e.getMessage());

        assertEquals(0, operationRows(firstBet.getOperationId()));
        assertEquals(0, operationRows(secondBet.getOperationId()));
        assertEquals(0, new BigDecimal("50").compareTo(ledgerService.getBalance(userId, Asset.USDT)));
        assertEquals(1, ledgerService.getHistory(userId, Asset.USDT, null, 100, 0).size());
        printSuccess("First bet rolled back with the second");
    }

    @Test
    @DisplayName("A bet and its win in one batch are applied in order and replay as a whole")
    void batchAppliesInOrder() {
        printTestHeader("Batch bet and win");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "20", Asset.USDT));
        List<BalanceUpdate> batch = List.of(
                update(BalanceOperationType.BET, "20", Asset.USDT),
                update(BalanceOperationType.WIN, "45", Asset.USDT));

        List<BalanceUpdateResult> results = ledgerService.updateBalances(batch);
        printOutput("Results", results);

        assertEquals(2, results.size());
        assertEquals(0, BigDecimal.ZERO.compareTo(results.get(0).getBalance()));
        assertEquals(0, new BigDecimal("45").compareTo(results.get(1).getBalance()));
        assertFalse(results.get(1).isReplayed());

        List<BalanceUpdateResult> replay = ledgerService.updateBalances(batch);
        assertTrue(replay.stream().allMatch(BalanceUpdateResult::isReplayed));
        assertEquals(0, new BigDecimal("45").compareTo(ledgerService.getBalance(userId, Asset.USDT)));
        printSuccess("Bet drained the balance, win refilled it");
    }

    @Test
    @DisplayName("Batches must be 1 to 50 distinct operations on one user and asset")
    void batchValidation() {
        assertThrows(IllegalArgumentException.class, () -> ledgerService.updateBalances(List.of()));

        List<BalanceUpdate> tooMany = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            tooMany.add(update(BalanceOperationType.DEPOSIT, "1", Asset.USDT));
        }
        IllegalArgumentException size = assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalances(tooMany));
        assertTrue(size.getMessage().contains("more than 50"));

        IllegalArgumentException mixed = assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalances(List.of(
                        update(BalanceOperationType.DEPOSIT, "5", Asset.USDT),
                        update(BalanceOperationType.DEPOSIT, "5", Asset.USDC))));
        assertTrue(mixed.getMessage().contains("same user and asset"));

        String operationId = "dup-" + UUID.randomUUID();
        IllegalArgumentException duplicate = assertThrows(IllegalArgumentException.class,
                () -> ledgerService.updateBalances(List.of(
                        update(BalanceOperationType.DEPOSIT, operationId, "5", Asset.USDT),
                        update(BalanceOperationType.DEPOSIT, operationId, "5", Asset.USDT))));
        assertTrue(duplicate.getMessage().contains(operationId));
        assertEquals(0, operationRows(operationId));
    }

    @Test
    @DisplayName("The daily withdrawal cap counts earlier entries of the same batch")
    void batchDailyWithdrawalCap() {
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "20", Asset.BTC));
        BalanceUpdate first = update(BalanceOperationType.WITHDRAW, "5", Asset.BTC);

        LimitExceededException e = assertThrows(LimitExceededException.class,
                () -> ledgerService.updateBalances(List.of(
                        first,
                        update(BalanceOperationType.WITHDRAW, "5", Asset.BTC),
                        update(BalanceOperationType.WITHDRAW, "1", Asset.BTC))));
        assertEquals(LimitKind.DAILY_WITHDRAW, e.getKind());
        assertEquals(0, operationRows(first.getOperationId()));
        assertEquals(0, new BigDecimal("20").compareTo(ledgerService.getBalance(userId, Asset.BTC)));
    }

    @Test
    @DisplayName("History is newest first and filters by asset and operation")
    void historyPaging() {
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "100", Asset.USDT));
        ledgerService.updateBalance(update(BalanceOperationType.BET, "10", Asset.USDT));
        ledgerService.updateBalance(update(BalanceOperationType.BET, "15", Asset.USDT));
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "3", Asset.USDC));

        List<BalanceOperation> all = ledgerService.getHistory(userId, null, null, 20, 0);
        assertEquals(4, all.size());

        List<BalanceOperation> bets = ledgerService.getHistory(userId, Asset.USDT, BalanceOperationType.BET, 20, 0);
        assertEquals(2, bets.size());
        assertEquals(0, new BigDecimal("15").compareTo(bets.get(0).getAmount()));

        List<BalanceOperation> secondPage = ledgerService.getHistory(userId, Asset.USDT, null, 2, 2);
        assertEquals(1, secondPage.size());
        assertEquals(BalanceOperationType.DEPOSIT, secondPage.get(0).getOperation());

        assertThrows(IllegalArgumentException.class, () -> ledgerService.getHistory(userId, null, null, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> ledgerService.getHistory(userId, null, null, 20, -1));
    }

    @Test
    @DisplayName("Withdrawals past the daily cap are refused")
    void dailyWithdrawalCap() {
        printTestHeader("Daily withdrawal cap");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "20", Asset.BTC));
        ledgerService.updateBalance(update(BalanceOperationType.WITHDRAW, "5", Asset.BTC));
        ledgerService.updateBalance(update(BalanceOperationType.WITHDRAW, "4", Asset.BTC));

        LimitExceededException e = assertThrows(LimitExceededException.class,
                () -> ledgerService.updateBalance(update(BalanceOperationType.WITHDRAW, "2", Asset.BTC)));
        printExpectedException("LimitExceededException", e.getMessage());
        assertEquals(LimitKind.DAILY_WITHDRAW, e.getKind());
        assertTrue(e.getMessage().contains("Daily withdrawal limit of 10 BTC exceeded"));
        assertEquals(0, new BigDecimal("11").compareTo(ledgerService.getBalance(userId, Asset.BTC)));
    }

    @Test
    @DisplayName("Concurrent updates on one balance lose no writes")
    void concurrentUpdatesLoseNothing() throws Exception {
        printTestHeader("Concurrent updates on one balance");
        ledgerService.updateBalance(update(BalanceOperationType.DEPOSIT, "100", Asset.USDT));

        int threads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BalanceUpdateResult>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            BalanceOperationType type = i % 2 == 0 ? BalanceOperationType.BET : BalanceOperationType.WIN;
            BalanceUpdate update = update(type, "3", Asset.USDT);
            futures.add(executor.submit(() -> {
                start.await();
                return ledgerService.updateBalance(update);
            }));
        }
        start.countDown();
        for (Future<BalanceUpdateResult> future : futures) {
            assertTrue(future.get(60, TimeUnit.SECONDS).isSuccess());
        }
        executor.shutdown();

        BigDecimal balance = ledgerService.getBalance(userId, Asset.USDT);
        printOutput("Final balance", balance);
        assertEquals(0, new BigDecimal("100").compareTo(balance));
        assertEquals(threads + 1, ledgerService.getHistory(userId, Asset.USDT, null, 100, 0).size());
        printSuccess("Every update applied exactly once");
    }

    @Test
    @DisplayName("Five concurrent requests with one operationId yield one success and four conflicts")
    void operationIdRace() throws Exception {
        printTestHeader("Operation id race across assets");
        String operationId = "race-" + UUID.randomUUID();
        Asset[] assets = {Asset.BTC, Asset.ETH, Asset.LTC, Asset.DOGE, Asset.SOL};

        ExecutorService executor = Executors.newFixedThreadPool(assets.length);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (Asset asset : assets) {
            BalanceUpdate update = update(BalanceOperationType.DEPOSIT, operationId, "1", asset);
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    ledgerService.updateBalance(update);
                    successes.incrementAndGet();
                } catch (ConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        printOutput("Successes", successes.get());
        printOutput("Conflicts", conflicts.get());
        assertEquals(1, successes.get());
        assertEquals(4, conflicts.get());
        assertEquals(1, operationRows(operationId));
        assertEquals(1, ledgerService.getBalances(userId).size());
        printSuccess("Unique index admitted exactly one operation");
    }
}
