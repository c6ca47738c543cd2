package com.flagship.gambling_ledger.config;

import com.flagship.gambling_ledger.ledger.Asset;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-asset bounds bound from the {@code ledger.*} keys.
 *
 * referenceRate converts one unit of the asset into the currency spending
 * limits are expressed in. Bounds left unset are not enforced.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private BigDecimal maxBalance = new BigDecimal("999999999999");

    private Map<Asset, AssetSettings> assets = new HashMap<>();

    public AssetSettings forAsset(Asset asset) {
        return assets.getOrDefault(asset, AssetSettings.UNBOUNDED);
    }

    @Getter
    @Setter
    public static class AssetSettings {

        static final AssetSettings UNBOUNDED = new AssetSettings();

        private BigDecimal referenceRate = BigDecimal.ONE;
        private BigDecimal minDeposit;
        private BigDecimal maxDeposit;
        private BigDecimal minWithdraw;
        private BigDecimal maxWithdraw;
        private BigDecimal dailyWithdrawLimit;
    }
}
