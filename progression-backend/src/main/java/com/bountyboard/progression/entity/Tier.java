package com.bountyboard.progression.entity;

/**
 * 悬赏金额档位（RTC 计价），用于把可变奖励映射为固定 XP。
 */
public enum Tier {
    MICRO,
    STANDARD,
    MAJOR,
    CRITICAL
}
