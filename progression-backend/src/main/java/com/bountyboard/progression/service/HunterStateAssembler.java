package com.bountyboard.progression.service;

import com.bountyboard.progression.badge.BadgeRegistry;
import com.bountyboard.progression.config.ThresholdTables;
import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.dto.AwardRecordDTO;
import com.bountyboard.progression.dto.BadgeGrantDTO;
import com.bountyboard.progression.dto.HunterStateDTO;
import com.bountyboard.progression.entity.Award;
import com.bountyboard.progression.entity.BadgeGrant;
import com.bountyboard.progression.entity.Hunter;
import com.bountyboard.progression.publish.HunterDocumentSource;
import com.bountyboard.progression.util.HunterIds;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 实体 → DTO / 徽章文档数据源的转换
 */
@Component
public class HunterStateAssembler {

    private static final int SUMMARY_MAX_LENGTH = 300;

    private final ThresholdTables thresholdTables;
    private final BadgeRegistry badgeRegistry;

    public HunterStateAssembler(ThresholdTables thresholdTables, BadgeRegistry badgeRegistry) {
        this.thresholdTables = thresholdTables;
        this.badgeRegistry = badgeRegistry;
    }

    public HunterStateDTO toState(Hunter hunter, List<BadgeGrant> grants) {
        ThresholdTables.LevelEntry level = thresholdTables.levelFor(hunter.getCumulativeXp());
        Optional<ThresholdTables.LevelEntry> next = thresholdTables.nextLevel(level);
        return HunterStateDTO.builder()
                .hunterId(hunter.getHunterId())
                .handle(hunter.getHandle())
                .walletRef(hunter.getWalletRef())
                .cumulativeXp(hunter.getCumulativeXp())
                .level(hunter.getLevel())
                .title(hunter.getTitle())
                .perk(level.perk())
                .nextLevelXp(next.map(ThresholdTables.LevelEntry::minXp).orElse(null))
                .xpToNextLevel(next.map(n -> n.minXp() - hunter.getCumulativeXp()).orElse(null))
                .firstAwardTime(hunter.getFirstAwardTime())
                .lastActionTime(hunter.getLastActionTime())
                .lastActionSummary(hunter.getLastActionSummary())
                .badges(grants.stream().map(this::toGrant).collect(Collectors.toList()))
                .newlyGrantedBadges(new ArrayList<>())
                .build();
    }

    public BadgeGrantDTO toGrant(BadgeGrant grant) {
        return new BadgeGrantDTO(
                grant.getBadgeKey(),
                badgeRegistry.displayName(grant.getBadgeKey()),
                grant.getQualifyingTime(),
                grant.getGrantedTime(),
                grant.isRetroactive());
    }

    public AwardRecordDTO toRecord(Award award) {
        return AwardRecordDTO.builder()
                .awardId(award.getAwardId())
                .hunterId(award.getHunterId())
                .actionKind(award.getActionKind().getWireName())
                .referenceAmount(award.getReferenceAmount())
                .tier(award.getTier() == null ? null : award.getTier().name())
                .xpAmount(award.getXpAmount())
                .sourceRef(award.getSourceRef())
                .occurredTime(award.getOccurredTime())
                .recordedTime(award.getRecordedTime())
                .idempotencyKey(award.getIdempotencyKey())
                .degraded(award.isDegraded())
                .backfilled(award.isBackfilled())
                .reason(award.getReason())
                .build();
    }

    /**
     * 导出格式：可以原样提交给回填接口。hunterId 使用展示 handle，回放后展示名不丢失
     */
    public AwardEventDTO toEvent(Award award, Hunter hunter) {
        return AwardEventDTO.builder()
                .hunterId(hunter != null ? hunter.getHandle() : award.getHunterId())
                .actionKind(award.getActionKind().getWireName())
                .referenceAmount(award.getReferenceAmount() == null ? null : award.getReferenceAmount().toPlainString())
                .sourceRef(award.getSourceRef())
                .timestamp(award.getOccurredTime())
                .idempotencyKey(award.getIdempotencyKey())
                .walletRef(hunter != null ? hunter.getWalletRef() : null)
                .build();
    }

    public HunterDocumentSource toDocumentSource(Hunter hunter, List<Award> awards, List<BadgeGrant> grants) {
        int completed = 0;
        BigDecimal rtc = BigDecimal.ZERO;
        for (Award award : awards) {
            if (award.getActionKind().isCompletion()) {
                completed++;
                if (award.getReferenceAmount() != null) {
                    rtc = rtc.add(award.getReferenceAmount());
                }
            }
        }
        return HunterDocumentSource.builder()
                .hunterId(hunter.getHunterId())
                .slug(HunterIds.slugify(hunter.getHunterId()))
                .handle(hunter.getHandle())
                .xp(hunter.getCumulativeXp())
                .level(hunter.getLevel())
                .title(hunter.getTitle())
                .earnedBadges(grants.stream().map(BadgeGrant::getBadgeKey).collect(Collectors.toCollection(TreeSet::new)))
                .completedCount(completed)
                .rtcEarned(rtc)
                .firstAwardTime(hunter.getFirstAwardTime())
                .lastActionTime(hunter.getLastActionTime())
                .version(awards.size())
                .build();
    }

    /**
     * 最近动作的描述，例如 "PR merged, standard tier (owner/repo#12)"
     */
    public static String summarize(Award award) {
        String summary = award.getReason() + " (" + award.getSourceRef() + ")";
        return summary.length() > SUMMARY_MAX_LENGTH ? summary.substring(0, SUMMARY_MAX_LENGTH) : summary;
    }
}
