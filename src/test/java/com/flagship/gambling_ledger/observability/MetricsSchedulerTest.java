package com.flagship.gambling_ledger.observability;

import com.flagship.gambling_ledger.IntegrationTestSupport;
import com.flagship.gambling_ledger.exclusion.NewSelfExclusion;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusionService;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import com.flagship.gambling_ledger.ledger.Asset;
import com.flagship.gambling_ledger.ledger.BalanceLedgerService;
import com.flagship.gambling_ledger.ledger.BalanceOperationType;
import com.flagship.gambling_ledger.ledger.BalanceUpdate;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cached gauges pick up database state on refresh. The publisher is off in
 * this context, so outbox rows stay pending.
 */
@SpringBootTest
class MetricsSchedulerTest extends IntegrationTestSupport {

    @Autowired
    private MetricsScheduler metricsScheduler;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private BalanceLedgerService ledgerService;

    @Autowired
    private SelfExclusionService selfExclusionService;

    private double gauge(String name, String tag, String value) {
        return meterRegistry.get(name).tag(tag, value).gauge().value();
    }

    @Test
    @DisplayName("Backlog is reported per aggregate after a refresh")
    void backlogPerAggregate() {
        printTestHeader("Outbox backlog gauges");
        UUID userId = UUID.randomUUID();
        ledgerService.updateBalance(BalanceUpdate.builder()
                .operation(BalanceOperationType.DEPOSIT)
                .operationId("metrics-" + UUID.randomUUID())
                .userId(userId)
                .amount(new BigDecimal("25"))
                .asset(Asset.USDT)
                .build());
        selfExclusionService.create(userId, NewSelfExclusion.builder()
                .type(SelfExclusionType.COOLDOWN)
                .platformType(PlatformType.CASINO)
                .build());

        metricsScheduler.refresh();

        double balanceBacklog = gauge("outbox.backlog.size", "aggregate", "Balance");
        double exclusionBacklog = gauge("outbox.backlog.size", "aggregate", "SelfExclusion");
        printOutput("Balance backlog", balanceBacklog);
        printOutput("SelfExclusion backlog", exclusionBacklog);

        assertTrue(balanceBacklog >= 1);
        assertTrue(exclusionBacklog >= 1);
        assertTrue(meterRegistry.get("outbox.backlog.age.seconds").gauge().value() >= 0);
        printSuccess("Both aggregates have a backlog series");
    }

    @Test
    @DisplayName("Active exclusions are counted per type, limits included")
    void activeExclusionsPerType() {
        printTestHeader("Active exclusion gauges");
        UUID userId = UUID.randomUUID();
        selfExclusionService.create(userId, NewSelfExclusion.builder()
                .type(SelfExclusionType.COOLDOWN)
                .platformType(PlatformType.SPORTS)
                .build());

        metricsScheduler.refresh();

        double cooldowns = gauge("exclusions.active", "type", "COOLDOWN");
        printOutput("Active cooldowns", cooldowns);
        assertTrue(cooldowns >= 1);

        for (SelfExclusionType type : SelfExclusionType.values()) {
            assertNotNull(meterRegistry.find("exclusions.active").tag("type", type.name()).gauge(),
                    "gauge registered for " + type);
        }
        printSuccess("One series per exclusion type");
    }
}
