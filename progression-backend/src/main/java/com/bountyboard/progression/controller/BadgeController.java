package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.BadgeDefinitionDTO;
import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.service.BadgeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/Badge")
public class BadgeController {

    private final BadgeService badgeService;

    public BadgeController(BadgeService badgeService) {
        this.badgeService = badgeService;
    }

    /**
     * **路径: /api/Badge/list**
     * 功能: 所有已注册徽章的定义与获得人数
     */
    @GetMapping("/list")
    public ResponseEntity<CommonResponse<List<BadgeDefinitionDTO>>> getBadgeList() {
        return ResponseEntity.ok(CommonResponse.success(badgeService.getBadgeList()));
    }
}
