package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 徽章定义 DTO，带获得人数统计
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeDefinitionDTO {

    private String badgeKey;

    private String name;

    private String category;

    private String description;

    private String color;

    private String logo;

    // 已获得该徽章的猎人数
    private long achievedCount;

    // 获得率（achievedCount / 猎人总数）
    private double completionRate;
}
