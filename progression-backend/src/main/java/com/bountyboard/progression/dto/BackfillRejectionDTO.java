package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRejectionDTO {

    // 在批次中的下标（从 0 开始）
    private int index;

    private String sourceRef;

    private String errorKind;

    private String message;
}
