package com.bountyboard.progression.badge.rules;

import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.badge.HunterProgress;
import com.bountyboard.progression.entity.Award;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 连续活跃：任意一个长度为 window 的时间窗内至少 count 条 award。
 * 按 award 自带的时间戳判断，与导入顺序无关。
 */
public class StreakRule implements BadgeRule {

    private final String badgeKey;
    private final String name;
    private final int count;
    private final Duration window;

    public StreakRule(String badgeKey, String name, int count, Duration window) {
        this.badgeKey = badgeKey;
        this.name = name;
        this.count = count;
        this.window = window;
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
        return "activity";
    }

    @Override
    public String getDescription() {
        return count + " awards within " + window.toDays() + " days.";
    }

    @Override
    public boolean matches(HunterProgress progress) {
        // awards 已按时间排序，滑动窗口
        List<Award> awards = progress.getAwards();
        for (int end = count - 1; end < awards.size(); end++) {
            LocalDateTime first = awards.get(end - count + 1).getOccurredTime();
            LocalDateTime last = awards.get(end).getOccurredTime();
            if (Duration.between(first, last).compareTo(window) <= 0) {
                return true;
            }
        }
        return false;
    }
}
