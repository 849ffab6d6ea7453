package com.bountyboard.progression.badge;

/**
 * 徽章规则接口。每个实现负责一种徽章，对猎人的完整状态给出是否满足。
 * 谓词必须对 award 集合单调：增加 award 不会让已满足的条件变为不满足，
 * 这样重放顺序不影响最终的徽章集合。
 */
public interface BadgeRule {

    /**
     * 徽章唯一 key（对应 badge_grant.badge_key）
     */
    String getBadgeKey();

    String getName();

    String getCategory();

    String getDescription();

    boolean matches(HunterProgress progress);
}
