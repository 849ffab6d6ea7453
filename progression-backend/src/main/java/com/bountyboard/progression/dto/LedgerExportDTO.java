package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 账本导出。awards 按到达顺序排列，可原样提交给回填接口重建全部状态
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerExportDTO {

    private LocalDateTime exportedTime;

    private List<AwardEventDTO> awards;

    private List<HunterStateDTO> hunters;
}
