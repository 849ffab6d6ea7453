package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.dto.AwardRecordDTO;
import com.bountyboard.progression.dto.BackfillReportDTO;
import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.dto.LedgerExportDTO;
import com.bountyboard.progression.dto.LedgerVerificationDTO;
import com.bountyboard.progression.dto.RecomputeReportDTO;
import com.bountyboard.progression.service.LedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * 批量导入历史 award，单条失败只记录在报告中
     */
    @PostMapping("/backfill")
    public ResponseEntity<CommonResponse<BackfillReportDTO>> backfill(@RequestBody List<AwardEventDTO> events) {
        return ResponseEntity.ok(CommonResponse.success(ledgerService.backfill(events)));
    }

    /**
     * 不带 hunterId 时对所有猎人执行 catch-up
     */
    @PostMapping("/recompute")
    public ResponseEntity<CommonResponse<RecomputeReportDTO>> recompute(
            @RequestParam(required = false) String hunterId) {
        RecomputeReportDTO report = (hunterId == null || hunterId.isBlank())
                ? ledgerService.recomputeAll()
                : ledgerService.recompute(hunterId);
        return ResponseEntity.ok(CommonResponse.success(report));
    }

    @GetMapping("/verify")
    public ResponseEntity<CommonResponse<LedgerVerificationDTO>> verify() {
        return ResponseEntity.ok(CommonResponse.success(ledgerService.verify()));
    }

    @GetMapping("/export")
    public ResponseEntity<CommonResponse<LedgerExportDTO>> export() {
        return ResponseEntity.ok(CommonResponse.success(ledgerService.export()));
    }

    // 待人工复核的 award
    @GetMapping("/degraded")
    public ResponseEntity<CommonResponse<List<AwardRecordDTO>>> degraded() {
        return ResponseEntity.ok(CommonResponse.success(ledgerService.degraded()));
    }
}
