package com.bountyboard.progression.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * 可获得 XP 的贡献动作类型。
 * wireName 为触发方（webhook / 回填批次）使用的 kebab-case 名称。
 */
public enum ActionKind {

    CLAIM("claim", false, false),
    PR_SUBMITTED("pr-submitted", true, false),
    PR_MERGED("pr-merged", true, true),
    TUTORIAL_ACCEPTED("tutorial-accepted", false, true),
    BUG_ACCEPTED("bug-accepted", false, true),
    OUTREACH_ACCEPTED("outreach-accepted", false, true),
    VINTAGE_PROOF("vintage-proof", false, true),
    FIRST_COMPLETION_BONUS("first-completion-bonus", false, false);

    private final String wireName;
    private final boolean tierClassified;
    private final boolean completion;

    ActionKind(String wireName, boolean tierClassified, boolean completion) {
        this.wireName = wireName;
        this.tierClassified = tierClassified;
        this.completion = completion;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 是否需要按 RTC 金额分档（PR 提交 / 合并）
     */
    public boolean isTierClassified() {
        return tierClassified;
    }

    /**
     * 是否计入"已完成悬赏"统计（徽章文档中的 bounties / rtc 指标）
     */
    public boolean isCompletion() {
        return completion;
    }

    /**
     * 同时接受 wire 名称（pr-merged）和枚举名（PR_MERGED）。
     */
    public static Optional<ActionKind> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String token = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ActionKind kind : values()) {
            if (kind.wireName.equals(token)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
