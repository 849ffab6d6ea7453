package com.bountyboard.progression.service;

import com.bountyboard.progression.badge.BadgeRegistry;
import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.badge.HunterProgress;
import com.bountyboard.progression.config.ThresholdTables;
import com.bountyboard.progression.entity.Award;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 等级 / 徽章评估器：只依赖猎人的 award 历史，没有任何隐藏状态。
 * 按 (occurredTime, awardId) 重放，同一组 award 无论以什么顺序写入结果都相同。
 */
@Component
public class ProgressionEvaluator {

    static final Comparator<Award> REPLAY_ORDER = Comparator
            .comparing(Award::getOccurredTime)
            .thenComparing(Award::getAwardId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ThresholdTables thresholdTables;
    private final BadgeRegistry badgeRegistry;

    public ProgressionEvaluator(ThresholdTables thresholdTables, BadgeRegistry badgeRegistry) {
        this.thresholdTables = thresholdTables;
        this.badgeRegistry = badgeRegistry;
    }

    public Evaluation evaluate(String hunterId, String handle, List<Award> awards) {
        List<Award> ordered = new ArrayList<>(awards);
        ordered.sort(REPLAY_ORDER);

        List<BadgeRule> pending = new ArrayList<>(badgeRegistry.all());
        Map<String, LocalDateTime> qualifying = new LinkedHashMap<>();
        HunterProgress progress = new HunterProgress(hunterId, handle);

        for (Award award : ordered) {
            progress.append(award);
            // 谓词单调，满足过的规则不再检查
            pending.removeIf(rule -> {
                if (rule.matches(progress)) {
                    qualifying.put(rule.getBadgeKey(), award.getOccurredTime());
                    return true;
                }
                return false;
            });
        }

        long xp = progress.getCumulativeXp();
        return new Evaluation(
                xp,
                thresholdTables.levelFor(xp),
                ordered.isEmpty() ? null : ordered.get(0).getOccurredTime(),
                ordered.isEmpty() ? null : ordered.get(ordered.size() - 1),
                qualifying);
    }

    /**
     * 重放结果
     *
     * @param badgeQualifyingTimes 满足的徽章 key → 首次满足时的 award 时间，按满足顺序
     */
    public record Evaluation(long cumulativeXp,
                             ThresholdTables.LevelEntry level,
                             LocalDateTime firstAwardTime,
                             Award lastAction,
                             Map<String, LocalDateTime> badgeQualifyingTimes) {
    }
}
