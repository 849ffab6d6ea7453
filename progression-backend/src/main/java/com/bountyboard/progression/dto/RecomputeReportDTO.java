package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重算（catch-up）结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecomputeReportDTO {

    private int huntersRecomputed;

    // 缓存 XP 与重放结果不一致而被修正的猎人数，正常应为 0
    private int xpCorrections;

    private int levelCorrections;

    // 本次补发的徽章数
    private int badgesGranted;
}
