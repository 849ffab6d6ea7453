package com.bountyboard.progression.badge;

import com.bountyboard.progression.badge.rules.AgentOverlordRule;
import com.bountyboard.progression.badge.rules.AwardCountRule;
import com.bountyboard.progression.badge.rules.StreakRule;
import com.bountyboard.progression.badge.rules.XpThresholdRule;
import com.bountyboard.progression.entity.ActionKind;
import com.bountyboard.progression.entity.Tier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 默认徽章目录。添加新徽章只需要再声明一个 BadgeRule Bean。
 */
@Configuration
public class BadgeCatalog {

    // 合并类
    @Bean
    public BadgeRule firstBloodRule() {
        return new AwardCountRule("FIRST_BLOOD", "First Blood", "merge",
                "First pull request merged.",
                a -> a.getActionKind() == ActionKind.PR_MERGED, 1);
    }

    // XP 里程碑类
    @Bean
    public BadgeRule risingHunterRule() {
        return new XpThresholdRule("RISING_HUNTER", "Rising Hunter", 1000);
    }

    @Bean
    public BadgeRule multiplierHunterRule() {
        return new XpThresholdRule("MULTIPLIER_HUNTER", "Multiplier Hunter", 2000);
    }

    @Bean
    public BadgeRule veteranHunterRule() {
        return new XpThresholdRule("VETERAN_HUNTER", "Veteran Hunter", 5500);
    }

    @Bean
    public BadgeRule legendaryHunterRule() {
        return new XpThresholdRule("LEGENDARY_HUNTER", "Legendary Hunter", 18000);
    }

    // 贡献类型类
    @Bean
    public BadgeRule vintageVeteranRule() {
        return new AwardCountRule("VINTAGE_VETERAN", "Vintage Veteran", "contribution",
                "Provided a vintage hardware proof.",
                a -> a.getActionKind() == ActionKind.VINTAGE_PROOF, 1);
    }

    @Bean
    public BadgeRule tutorialTitanRule() {
        return new AwardCountRule("TUTORIAL_TITAN", "Tutorial Titan", "contribution",
                "Had a tutorial or docs contribution accepted.",
                a -> a.getActionKind() == ActionKind.TUTORIAL_ACCEPTED, 1);
    }

    @Bean
    public BadgeRule bugSlayerRule() {
        return new AwardCountRule("BUG_SLAYER", "Bug Slayer", "contribution",
                "Had a bug report accepted or merged a critical-tier fix.",
                a -> a.getActionKind() == ActionKind.BUG_ACCEPTED
                        || (a.getActionKind() == ActionKind.PR_MERGED && a.getTier() == Tier.CRITICAL), 1);
    }

    @Bean
    public BadgeRule outreachProRule() {
        return new AwardCountRule("OUTREACH_PRO", "Outreach Pro", "contribution",
                "Had an outreach contribution accepted.",
                a -> a.getActionKind() == ActionKind.OUTREACH_ACCEPTED, 1);
    }

    // 活跃度类
    @Bean
    public BadgeRule streakMasterRule() {
        return new StreakRule("STREAK_MASTER", "Streak Master", 3, Duration.ofDays(7));
    }

    @Bean
    public BadgeRule agentOverlordRule() {
        return new AgentOverlordRule(500);
    }
}
