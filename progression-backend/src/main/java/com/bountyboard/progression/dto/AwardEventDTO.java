package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 触发方投递的原始事件，也是回填批次和账本导出中 awards 的格式。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardEventDTO {

    // 猎人 handle，允许带 @ 和大小写差异
    private String hunterId;

    // wire 名称（pr-merged）或枚举名（PR_MERGED）
    private String actionKind;

    /**
     * RTC 参考金额。接受 25、"25"、"25 RTC"，只对 PR 提交 / 合并有意义
     */
    private String referenceAmount;

    // issue / PR 链接等来源引用
    private String sourceRef;

    /**
     * 事件发生时间（UTC）。实时事件可省略，回填必须提供
     */
    private LocalDateTime timestamp;

    // 为空时由账本计算
    private String idempotencyKey;

    private String walletRef;
}
