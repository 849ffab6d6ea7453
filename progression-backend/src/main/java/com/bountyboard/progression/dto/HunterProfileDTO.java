package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单个猎人的完整档案：状态、排名、全部 award（按到达顺序）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HunterProfileDTO {

    private HunterStateDTO state;

    private int rank;

    private List<AwardRecordDTO> awards;
}
