package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 看板总览：总 XP、活跃猎人、传奇猎人、榜首、前三、周增长
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoardSummaryDTO {

    private long totalXp;

    private long activeHunters;

    private long legendaryHunters;

    // 没有猎人时为 null
    private LeaderboardEntryDTO topHunter;

    private List<LeaderboardEntryDTO> topThree;

    /**
     * 最近 7 天（按 award 时间戳）获得的 XP 总和
     */
    private long weeklyGrowth;

    private LocalDateTime generatedTime;
}
