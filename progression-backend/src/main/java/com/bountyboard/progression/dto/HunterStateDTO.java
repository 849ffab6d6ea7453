package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 猎人当前状态快照（append 的返回值、导出中的 hunters 部分）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HunterStateDTO {

    private String hunterId;

    private String handle;

    private String walletRef;

    private long cumulativeXp;

    private int level;

    private String title;

    private String perk;

    // 已是最高等级时为 null
    private Long nextLevelXp;

    private Long xpToNextLevel;

    private LocalDateTime firstAwardTime;

    private LocalDateTime lastActionTime;

    private String lastActionSummary;

    private List<BadgeGrantDTO> badges;

    /**
     * 本次 append 新获得的徽章 key，其他场景为空列表
     */
    private List<String> newlyGrantedBadges;

    // 本次 append 对应的 award，其他场景为 null
    private AwardRecordDTO award;
}
