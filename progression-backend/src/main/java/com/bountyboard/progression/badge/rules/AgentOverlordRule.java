package com.bountyboard.progression.badge.rules;

import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.badge.HunterProgress;

import java.util.Locale;

/**
 * 自动化代理类猎人（handle 含 agent）达到 XP 阈值
 */
public class AgentOverlordRule implements BadgeRule {

    private final long minXp;

    public AgentOverlordRule(long minXp) {
        this.minXp = minXp;
    }

    @Override
    public String getBadgeKey() {
        return "AGENT_OVERLORD";
    }

    @Override
    public String getName() {
        return "Agent Overlord";
    }

    @Override
    public String getCategory() {
        return "milestone";
    }

    @Override
    public String getDescription() {
        return "Autonomous agent that reached " + minXp + " XP.";
    }

    @Override
    public boolean matches(HunterProgress progress) {
        String handle = progress.getHandle() == null ? "" : progress.getHandle().toLowerCase(Locale.ROOT);
        return handle.contains("agent") && progress.getCumulativeXp() >= minXp;
    }
}
