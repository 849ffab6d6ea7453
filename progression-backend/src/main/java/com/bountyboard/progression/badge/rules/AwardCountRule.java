package com.bountyboard.progression.badge.rules;

import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.badge.HunterProgress;
import com.bountyboard.progression.entity.Award;

import java.util.function.Predicate;

/**
 * 计数类徽章：满足过滤条件的 award 至少 minCount 条
 */
public class AwardCountRule implements BadgeRule {

    private final String badgeKey;
    private final String name;
    private final String category;
    private final String description;
    private final Predicate<Award> filter;
    private final int minCount;

    public AwardCountRule(String badgeKey, String name, String category, String description,
                          Predicate<Award> filter, int minCount) {
        this.badgeKey = badgeKey;
        this.name = name;
        this.category = category;
        this.description = description;
        this.filter = filter;
        this.minCount = minCount;
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
        return category;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean matches(HunterProgress progress) {
        return progress.getAwards().stream().filter(filter).limit(minCount).count() >= minCount;
    }
}
