package com.bountyboard.progression.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Award Entity: 一次不可变的 XP 奖励记录。
 * award_id 自增，即到达顺序；idempotency_key 唯一，保证同一真实事件只计一次。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "award",
        uniqueConstraints = @UniqueConstraint(name = "uk_award_idempotency_key", columnNames = "idempotency_key"),
        indexes = @Index(name = "idx_award_hunter", columnList = "hunter_id"))
public class Award {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "award_id")
    private Long awardId;

    @Column(name = "hunter_id", nullable = false, length = 100)
    private String hunterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_kind", nullable = false, length = 40)
    private ActionKind actionKind;

    /**
     * RTC 参考金额，只用于分档，不作为货币存储
     */
    @Column(name = "reference_amount", precision = 18, scale = 4)
    private BigDecimal referenceAmount;

    /**
     * 仅 PR 提交 / 合并有档位
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "tier", length = 20)
    private Tier tier;

    @Column(name = "xp_amount", nullable = false)
    private int xpAmount;

    @Column(name = "source_ref", nullable = false, length = 200)
    private String sourceRef;

    @Column(name = "occurred_time", nullable = false)
    private LocalDateTime occurredTime;

    @Column(name = "recorded_time", nullable = false)
    private LocalDateTime recordedTime;

    @Column(name = "idempotency_key", nullable = false, length = 128)
    private String idempotencyKey;

    /**
     * 金额缺失或格式错误时按最低档处理，并标记待人工复核
     */
    @Column(name = "degraded", nullable = false)
    private boolean degraded;

    @Column(name = "backfilled", nullable = false)
    private boolean backfilled;

    @Column(name = "reason", nullable = false, length = 200)
    private String reason;
}
