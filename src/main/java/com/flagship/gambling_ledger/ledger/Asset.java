package com.flagship.gambling_ledger.ledger;

/**
 * Assets a balance can be held in.
 *
 * Stored by name, so the database never holds an unknown asset code.
 */
public enum Asset {
    BTC,
    ETH,
    LTC,
    DOGE,
    TRX,
    XRP,
    SOL,
    USDT,
    USDC;

    /** Maximum fractional digits accepted for any asset. */
    public static final int MAX_SCALE = 8;

    public static Asset parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Asset is required");
        }
        try {
            return Asset.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported asset: " + code);
        }
    }
}
