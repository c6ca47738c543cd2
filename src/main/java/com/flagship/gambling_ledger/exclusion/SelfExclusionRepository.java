package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.limits.LimitPeriod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SelfExclusionRepository extends JpaRepository<SelfExclusionEntity, UUID> {

    List<SelfExclusionEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<SelfExclusionEntity> findByUserIdAndActiveTrue(UUID userId);

    Optional<SelfExclusionEntity> findByIdAndUserId(UUID id, UUID userId);

    @Query("""
        SELECT e FROM SelfExclusionEntity e
        WHERE e.userId = :userId AND e.active = true AND e.type IN :types
        ORDER BY e.createdAt ASC
        """)
    List<SelfExclusionEntity> findActiveByTypes(@Param("userId") UUID userId,
                                                @Param("types") Collection<SelfExclusionType> types);

    Optional<SelfExclusionEntity> findByUserIdAndTypeAndPlatformTypeAndActiveTrue(
        UUID userId, SelfExclusionType type, PlatformType platformType);

    Optional<SelfExclusionEntity> findByUserIdAndTypeAndPlatformTypeAndPeriodAndActiveTrue(
        UUID userId, SelfExclusionType type, PlatformType platformType, LimitPeriod period);

    /** Rows of (type, count) over active rows. */
    @Query("SELECT e.type, COUNT(e) FROM SelfExclusionEntity e WHERE e.active = true GROUP BY e.type")
    List<Object[]> countActiveByType();

    // Expiry housekeeping. Every statement re-checks its own precondition in
    // the WHERE clause, so a second run, or a concurrent one, matches nothing.

    @Modifying
    @Query(value = """
        UPDATE self_exclusions
        SET post_cooldown_window_end = end_date + make_interval(secs => CAST(:windowSeconds AS double precision)),
            updated_at = :now
        WHERE type = 'COOLDOWN' AND is_active
          AND end_date < :now
          AND post_cooldown_window_end IS NULL
        """, nativeQuery = true)
    int openPostCooldownWindows(@Param("now") Instant now, @Param("windowSeconds") long windowSeconds);

    @Modifying
    @Query(value = """
        DELETE FROM self_exclusions
        WHERE type = 'COOLDOWN'
          AND post_cooldown_window_end IS NOT NULL
          AND post_cooldown_window_end < :now
        """, nativeQuery = true)
    int deleteLapsedCooldowns(@Param("now") Instant now);

    @Modifying
    @Query(value = """
        UPDATE self_exclusions
        SET is_active = FALSE, updated_at = :now
        WHERE type = 'TEMPORARY' AND is_active
          AND end_date < :now
        """, nativeQuery = true)
    int deactivateExpiredTemporaryExclusions(@Param("now") Instant now);

    @Modifying
    @Query(value = """
        DELETE FROM self_exclusions
        WHERE type IN ('DEPOSIT_LIMIT', 'LOSS_LIMIT', 'WAGER_LIMIT')
          AND removal_requested_at IS NOT NULL
          AND removal_requested_at <= :cutoff
        """, nativeQuery = true)
    int deleteLimitsPastRemovalGrace(@Param("cutoff") Instant cutoff);
}
