package com.flagship.gambling_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the balances table.
 *
 * Every write is a single statement whose WHERE clause carries the
 * overdraft rule, so the database never stores a balance that violates it
 * even if two writers slip past the lock.
 */
@Repository
public class BalanceStore {

    private final JdbcTemplate jdbcTemplate;

    public BalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<BigDecimal> findBalance(UUID userId, Asset asset) {
        List<BigDecimal> rows = jdbcTemplate.query(
            "SELECT balance FROM balances WHERE user_id = ? AND asset = ?",
            (rs, rowNum) -> rs.getBigDecimal("balance"),
            userId,
            asset.name()
        );
        return rows.stream().findFirst();
    }

    public List<Balance> findBalances(UUID userId) {
        return jdbcTemplate.query(
            "SELECT user_id, asset, balance, updated_at FROM balances WHERE user_id = ? ORDER BY asset",
            balanceRowMapper(),
            userId
        );
    }

    /**
     * Adds delta to the balance, creating the row when missing.
     * Used for credits and for correction kinds that may overdraw.
     *
     * @return the balance after the write
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal upsert(UUID userId, Asset asset, BigDecimal delta) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO balances (user_id, asset, balance, created_at, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (user_id, asset) DO UPDATE " +
            "SET balance = balances.balance + EXCLUDED.balance, updated_at = CURRENT_TIMESTAMP " +
            "RETURNING balance",
            BigDecimal.class,
            userId,
            asset.name(),
            delta
        );
    }

    /**
     * Subtracts amount only if the result stays non-negative.
     *
     * @return the new balance, or empty when the row is missing or the
     *         balance is insufficient
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<BigDecimal> debitIfSufficient(UUID userId, Asset asset, BigDecimal amount) {
        List<BigDecimal> rows = jdbcTemplate.query(
            "UPDATE balances SET balance = balance - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND asset = ? AND balance - ? >= 0 " +
            "RETURNING balance",
            (rs, rowNum) -> rs.getBigDecimal(1),
            amount,
            userId,
            asset.name(),
            amount
        );
        return rows.stream().findFirst();
    }

    private RowMapper<Balance> balanceRowMapper() {
        return (rs, rowNum) -> new Balance(
            UUID.fromString(rs.getString("user_id")),
            Asset.valueOf(rs.getString("asset")),
            rs.getBigDecimal("balance"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
