package com.bountyboard.progression.service;

import com.bountyboard.progression.dto.BadgeDefinitionDTO;

import java.util.List;

public interface BadgeService {

    /**
     * 所有已注册徽章的定义和获得人数
     */
    List<BadgeDefinitionDTO> getBadgeList();
}
