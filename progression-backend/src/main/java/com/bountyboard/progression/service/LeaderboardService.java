package com.bountyboard.progression.service;

import com.bountyboard.progression.dto.BoardSummaryDTO;
import com.bountyboard.progression.dto.HunterProfileDTO;
import com.bountyboard.progression.dto.LeaderboardEntryDTO;
import com.bountyboard.progression.entity.Hunter;

import java.util.List;
import java.util.Map;

public interface LeaderboardService {

    /**
     * 纯排序：XP 降序，首次 award 时间升序，hunterId 升序
     *
     * @param badgeNames hunterId → 徽章展示名
     */
    List<LeaderboardEntryDTO> render(List<Hunter> hunters, Map<String, List<String>> badgeNames);

    // count 为空或 <= 0 时返回全部
    List<LeaderboardEntryDTO> getLeaderboard(Integer count);

    BoardSummaryDTO getSummary();

    HunterProfileDTO getHunterProfile(String hunterId);
}
