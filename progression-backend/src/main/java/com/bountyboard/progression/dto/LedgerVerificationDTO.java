package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerVerificationDTO {

    private int huntersChecked;

    private long awardsChecked;

    // drifts 为空即一致
    private boolean consistent;

    private List<HunterDriftDTO> drifts;

    private LocalDateTime verifiedTime;
}
