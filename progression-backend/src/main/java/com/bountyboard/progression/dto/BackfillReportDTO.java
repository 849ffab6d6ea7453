package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 回填结果。单条失败不影响整个批次
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackfillReportDTO {

    private int received;

    private int accepted;

    private int duplicates;

    private int rejected;

    // 已入账但金额无法识别、按最低档处理的条数
    private int degraded;

    private List<String> affectedHunters = new ArrayList<>();

    private List<BackfillRejectionDTO> rejections = new ArrayList<>();
}
