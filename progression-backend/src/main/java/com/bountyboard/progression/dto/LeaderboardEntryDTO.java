package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 排行榜中的一行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntryDTO {

    // 从 1 开始
    private int rank;

    private String hunterId;

    private String handle;

    private String walletRef;

    private long xp;

    private int level;

    private String title;

    // 徽章展示名，按字母排序
    private List<String> badges;

    private String lastAction;
}
