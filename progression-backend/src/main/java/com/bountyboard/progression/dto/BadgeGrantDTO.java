package com.bountyboard.progression.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeGrantDTO {

    private String badgeKey;

    private String name;

    /**
     * 按时间重放时首次满足条件的那条 award 的时间
     */
    private LocalDateTime qualifyingTime;

    /**
     * 实际记录授予的时间
     */
    private LocalDateTime grantedTime;

    private boolean retroactive;
}
