package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.limits.LimitPeriod;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for self-exclusions and limits.
 *
 * Identity, owner, type and scope are fixed at creation. Only the fields a
 * transition can change are writable, through {@link #updateFromDomain}.
 */
@Entity
@Table(
    name = "self_exclusions",
    indexes = {
        @Index(name = "idx_self_exclusions_user", columnList = "user_id, is_active")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SelfExclusionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private SelfExclusionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform_type", nullable = false, updatable = false, length = 20)
    private PlatformType platformType;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 20)
    private LimitPeriod period;

    @Column(name = "limit_amount", precision = 30, scale = 2)
    private BigDecimal limitAmount;

    @Column(name = "start_date", nullable = false, updatable = false)
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "removal_requested_at")
    private Instant removalRequestedAt;

    @Column(name = "post_cooldown_window_end")
    private Instant postCooldownWindowEnd;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static SelfExclusionEntity fromDomain(SelfExclusion exclusion) {
        return new SelfExclusionEntity(
            exclusion.getId(),
            exclusion.getUserId(),
            exclusion.getType(),
            exclusion.getPlatformType(),
            exclusion.getPeriod(),
            exclusion.getLimitAmount(),
            exclusion.getStartDate(),
            exclusion.getEndDate(),
            exclusion.isActive(),
            exclusion.getRemovalRequestedAt(),
            exclusion.getPostCooldownWindowEnd(),
            exclusion.getCreatedAt(),
            exclusion.getUpdatedAt()
        );
    }

    public SelfExclusion toDomain() {
        return new SelfExclusion(
            id,
            userId,
            type,
            platformType,
            period,
            limitAmount,
            startDate,
            endDate,
            active,
            removalRequestedAt,
            postCooldownWindowEnd,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(SelfExclusion exclusion) {
        this.limitAmount = exclusion.getLimitAmount();
        this.endDate = exclusion.getEndDate();
        this.active = exclusion.isActive();
        this.removalRequestedAt = exclusion.getRemovalRequestedAt();
        this.postCooldownWindowEnd = exclusion.getPostCooldownWindowEnd();
    }
}
