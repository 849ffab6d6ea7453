package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.publish.BadgeDocument;
import com.bountyboard.progression.publish.BadgeDocumentStore;
import com.bountyboard.progression.service.LedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * shields.io endpoint 徽章。GET 接口直接返回文档本身，不包 CommonResponse
 */
@RestController
@RequestMapping("/api/badges")
public class BadgeDocumentController {

    private final BadgeDocumentStore documentStore;
    private final LedgerService ledgerService;

    public BadgeDocumentController(BadgeDocumentStore documentStore, LedgerService ledgerService) {
        this.documentStore = documentStore;
        this.ledgerService = ledgerService;
    }

    /**
     * 看板级文档：hunter-stats / top-hunter / top-3-hunters / active-hunters / legendary-hunters / weekly-growth
     */
    @GetMapping("/board/{metric}")
    public ResponseEntity<BadgeDocument> getBoardDocument(@PathVariable String metric) {
        return documentStore.findBoardDocument(metric)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{slug}/{metric}")
    public ResponseEntity<BadgeDocument> getHunterDocument(@PathVariable String slug, @PathVariable String metric) {
        return documentStore.findHunterDocument(slug, metric)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/republish")
    public ResponseEntity<CommonResponse<Integer>> republish() {
        return ResponseEntity.ok(CommonResponse.success(ledgerService.republishAll()));
    }
}
