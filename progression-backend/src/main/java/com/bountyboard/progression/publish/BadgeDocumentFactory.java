package com.bountyboard.progression.publish;

import com.bountyboard.progression.badge.BadgeRegistry;
import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.config.ProgressionProperties;
import com.bountyboard.progression.config.ThresholdTables;
import com.bountyboard.progression.dto.BoardSummaryDTO;
import com.bountyboard.progression.dto.LeaderboardEntryDTO;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 徽章文档生成。纯函数：相同输入得到相同文档，不带任何时间戳
 */
@Component
public class BadgeDocumentFactory {

    public static final String XP_METRIC = "xp";
    static final String BADGE_METRIC_PREFIX = "badge-";

    private final ThresholdTables thresholdTables;
    private final BadgeRegistry badgeRegistry;

    public BadgeDocumentFactory(ThresholdTables thresholdTables, BadgeRegistry badgeRegistry) {
        this.thresholdTables = thresholdTables;
        this.badgeRegistry = badgeRegistry;
    }

    /**
     * 单个猎人的全部文档，key 为指标名
     */
    public SortedMap<String, BadgeDocument> hunterDocuments(HunterDocumentSource source) {
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put(XP_METRIC, BadgeDocument.of(
                source.getHandle() + " XP",
                source.getXp() + " (L" + source.getLevel() + " " + source.getTitle() + ")",
                colorForLevel(source.getLevel()), "github", "white"));
        docs.put("bounties", BadgeDocument.of(
                "Bounties",
                String.valueOf(source.getCompletedCount()),
                source.getCompletedCount() > 0 ? "brightgreen" : "blue", "check-circle", "white"));
        BigDecimal rtc = source.getRtcEarned() == null ? BigDecimal.ZERO : source.getRtcEarned();
        docs.put("rtc", BadgeDocument.of(
                "RTC Earned",
                rtc.stripTrailingZeros().toPlainString() + " RTC",
                rtc.signum() > 0 ? "orange" : "blue", "bitcoin", "white"));
        docs.put("age", BadgeDocument.of(
                "Account Age",
                formatAge(source.getFirstAwardTime(), source.getLastActionTime()),
                "blue", "clock", "white"));

        for (BadgeRule rule : badgeRegistry.all()) {
            ProgressionProperties.BadgeStyle style = thresholdTables.styleFor(rule.getBadgeKey());
            boolean earned = source.getEarnedBadges().contains(rule.getBadgeKey());
            docs.put(badgeMetric(rule.getBadgeKey()), BadgeDocument.of(
                    rule.getName(),
                    earned ? "earned" : "locked",
                    earned ? style.getColor() : "lightgrey",
                    style.getLogo(),
                    earned ? style.getLogoColor() : "white"));
        }
        return docs;
    }

    /**
     * 看板级文档
     */
    public SortedMap<String, BadgeDocument> boardDocuments(BoardSummaryDTO summary) {
        boolean any = summary.getTopHunter() != null;
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("hunter-stats", BadgeDocument.of(
                "Bounty Hunter XP",
                summary.getTotalXp() + " total",
                summary.getTotalXp() > 0 ? "orange" : "blue", "rust", "white"));
        docs.put("top-hunter", BadgeDocument.of(
                "Top Hunter",
                any ? summary.getTopHunter().getHandle() + " (" + summary.getTopHunter().getXp() + " XP)" : "none yet",
                any ? "gold" : "lightgrey", "crown", any ? "black" : "white"));
        docs.put("top-3-hunters", BadgeDocument.of(
                "Leaders",
                any ? summary.getTopThree().stream().map(LeaderboardEntryDTO::getHandle).collect(Collectors.joining(", "))
                        : "none yet",
                any ? "gold" : "lightgrey", "crown", "white"));
        docs.put("active-hunters", BadgeDocument.of(
                "Active Hunters", String.valueOf(summary.getActiveHunters()), "teal", "users", "white"));
        boolean legendary = summary.getLegendaryHunters() > 0;
        docs.put("legendary-hunters", BadgeDocument.of(
                "Legendary Hunters", String.valueOf(summary.getLegendaryHunters()),
                legendary ? "gold" : "lightgrey", "crown", legendary ? "black" : "white"));
        boolean growing = summary.getWeeklyGrowth() > 0;
        docs.put("weekly-growth", BadgeDocument.of(
                "Weekly XP", "+" + summary.getWeeklyGrowth(),
                growing ? "brightgreen" : "blue", growing ? "trending-up" : "dash", "white"));
        return docs;
    }

    /**
     * FIRST_BLOOD → badge-first-blood
     */
    public static String badgeMetric(String badgeKey) {
        return BADGE_METRIC_PREFIX + badgeKey.toLowerCase(Locale.ROOT).replace('_', '-');
    }

    static String colorForLevel(int level) {
        if (level >= 10) {
            return "gold";
        }
        if (level >= 7) {
            return "purple";
        }
        if (level >= 5) {
            return "yellow";
        }
        if (level >= 4) {
            return "orange";
        }
        return "blue";
    }

    /**
     * 首次 award 到最近一次动作的跨度：1y 2m / 3m 5d / 12d
     */
    static String formatAge(LocalDateTime first, LocalDateTime last) {
        if (first == null || last == null) {
            return "unknown";
        }
        if (last.isBefore(first)) {
            return "0d";
        }
        Period period = Period.between(first.toLocalDate(), last.toLocalDate());
        if (period.getYears() > 0) {
            return period.getYears() + "y " + period.getMonths() + "m";
        }
        if (period.getMonths() > 0) {
            return period.getMonths() + "m " + period.getDays() + "d";
        }
        return period.getDays() + "d";
    }
}
