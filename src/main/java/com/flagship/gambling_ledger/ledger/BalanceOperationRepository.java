package com.flagship.gambling_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BalanceOperationRepository extends JpaRepository<BalanceOperationEntity, UUID> {

    Optional<BalanceOperationEntity> findByOperationId(String operationId);

    long countByOperationId(String operationId);

    /**
     * One page of a user's operations, newest first. Null asset or
     * operation means no filter on that column.
     */
    @Query("""
        SELECT o FROM BalanceOperationEntity o
        WHERE o.userId = :userId
          AND (:asset IS NULL OR o.asset = :asset)
          AND (:operation IS NULL OR o.operation = :operation)
        ORDER BY o.createdAt DESC, o.id DESC
        LIMIT :limit OFFSET :offset
        """)
    List<BalanceOperationEntity> findHistory(@Param("userId") UUID userId,
                                             @Param("asset") Asset asset,
                                             @Param("operation") BalanceOperationType operation,
                                             @Param("limit") int limit,
                                             @Param("offset") int offset);

    /**
     * Total of one operation kind since the given instant, used for the
     * daily withdrawal cap.
     */
    @Query("""
        SELECT COALESCE(SUM(o.amount), 0) FROM BalanceOperationEntity o
        WHERE o.userId = :userId AND o.asset = :asset
          AND o.operation = :operation AND o.createdAt >= :since
        """)
    BigDecimal sumAmountSince(@Param("userId") UUID userId,
                              @Param("asset") Asset asset,
                              @Param("operation") BalanceOperationType operation,
                              @Param("since") Instant since);

    /**
     * Sum of signed amounts; equals the stored balance for a consistent ledger.
     */
    @Query("""
        SELECT COALESCE(SUM(o.signedAmount), 0) FROM BalanceOperationEntity o
        WHERE o.userId = :userId AND o.asset = :asset
        """)
    BigDecimal sumSignedAmounts(@Param("userId") UUID userId, @Param("asset") Asset asset);
}
