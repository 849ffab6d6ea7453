package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.dto.HunterStateDTO;
import com.bountyboard.progression.service.LedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 触发方（webhook / 审核流程）的事件入口
 */
@RestController
@RequestMapping("/api/awards")
public class AwardController {

    private final LedgerService ledgerService;

    public AwardController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * 写入一条事件。重复投递返回 409，未知动作 / 缺字段返回 400
     */
    @PostMapping
    public ResponseEntity<CommonResponse<HunterStateDTO>> appendAward(@RequestBody AwardEventDTO event) {
        HunterStateDTO state = ledgerService.append(event);
        return ResponseEntity.ok(CommonResponse.success(state));
    }
}
