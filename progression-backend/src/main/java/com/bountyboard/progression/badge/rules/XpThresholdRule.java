package com.bountyboard.progression.badge.rules;

import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.badge.HunterProgress;

/**
 * XP 里程碑：累计 XP 达到阈值
 */
public class XpThresholdRule implements BadgeRule {

    private final String badgeKey;
    private final String name;
    private final long minXp;

    public XpThresholdRule(String badgeKey, String name, long minXp) {
        this.badgeKey = badgeKey;
        this.name = name;
        this.minXp = minXp;
    }

    @Override
    public String getBadgeKey() {
        return badgeKey;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getCategory() {
        return "milestone";
    }

    @Override
    public String getDescription() {
        return "Reached " + minXp + " XP.";
    }

    @Override
    public boolean matches(HunterProgress progress) {
        return progress.getCumulativeXp() >= minXp;
    }
}
