package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.BoardSummaryDTO;
import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.dto.HunterProfileDTO;
import com.bountyboard.progression.dto.LeaderboardEntryDTO;
import com.bountyboard.progression.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/Hunter")
public class HunterController {

    private final LeaderboardService leaderboardService;

    public HunterController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @GetMapping("/ranking")
    public ResponseEntity<CommonResponse<List<LeaderboardEntryDTO>>> getRanking(
            @RequestParam(required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(leaderboardService.getLeaderboard(count)));
    }

    @GetMapping("/summary")
    public ResponseEntity<CommonResponse<BoardSummaryDTO>> getSummary() {
        return ResponseEntity.ok(CommonResponse.success(leaderboardService.getSummary()));
    }

    /**
     * 猎人档案。handle 大小写和前导 @ 不影响查找；不存在时返回 404
     */
    @GetMapping("/{hunter_id}")
    public ResponseEntity<CommonResponse<HunterProfileDTO>> getHunter(@PathVariable("hunter_id") String hunterId) {
        return ResponseEntity.ok(CommonResponse.success(leaderboardService.getHunterProfile(hunterId)));
    }
}
