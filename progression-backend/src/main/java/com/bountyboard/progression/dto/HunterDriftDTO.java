package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 缓存快照与重放结果的差异
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HunterDriftDTO {

    private String hunterId;

    private long cachedXp;

    private long replayedXp;

    private int cachedLevel;

    private int replayedLevel;

    private LocalDateTime cachedFirstAwardTime;

    private LocalDateTime replayedFirstAwardTime;

    private List<String> missingBadges;
}
