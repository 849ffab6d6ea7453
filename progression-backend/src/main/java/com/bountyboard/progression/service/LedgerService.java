package com.bountyboard.progression.service;

import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.dto.AwardRecordDTO;
import com.bountyboard.progression.dto.BackfillReportDTO;
import com.bountyboard.progression.dto.HunterStateDTO;
import com.bountyboard.progression.dto.LedgerExportDTO;
import com.bountyboard.progression.dto.LedgerVerificationDTO;
import com.bountyboard.progression.dto.RecomputeReportDTO;

import java.util.List;

/**
 * XP 账本。只有 append / backfill / recompute 会修改状态
 */
public interface LedgerService {

    /**
     * 实时写入一条事件，整体提交或整体回滚
     */
    HunterStateDTO append(AwardEventDTO event);

    BackfillReportDTO backfill(List<AwardEventDTO> events);

    RecomputeReportDTO recompute(String hunterId);

    RecomputeReportDTO recomputeAll();

    LedgerVerificationDTO verify();

    LedgerExportDTO export();

    List<AwardRecordDTO> degraded();

    /**
     * 重新生成所有猎人和看板的徽章文档，返回猎人数
     */
    int republishAll();
}
