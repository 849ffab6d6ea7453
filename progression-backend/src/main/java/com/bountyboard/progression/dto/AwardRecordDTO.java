package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 已入账的 award，只读视图
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardRecordDTO {

    private Long awardId;

    private String hunterId;

    // wire 名称
    private String actionKind;

    private BigDecimal referenceAmount;

    private String tier;

    private int xpAmount;

    private String sourceRef;

    private LocalDateTime occurredTime;

    private LocalDateTime recordedTime;

    private String idempotencyKey;

    private boolean degraded;

    private boolean backfilled;

    private String reason;
}
