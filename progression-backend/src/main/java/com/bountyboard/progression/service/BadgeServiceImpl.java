package com.bountyboard.progression.service;

import com.bountyboard.progression.badge.BadgeRegistry;
import com.bountyboard.progression.badge.BadgeRule;
import com.bountyboard.progression.config.ProgressionProperties;
import com.bountyboard.progression.config.ThresholdTables;
import com.bountyboard.progression.dto.BadgeDefinitionDTO;
import com.bountyboard.progression.repository.BadgeGrantRepository;
import com.bountyboard.progression.repository.HunterRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class BadgeServiceImpl implements BadgeService {

    private final BadgeRegistry badgeRegistry;
    private final BadgeGrantRepository badgeGrantRepository;
    private final HunterRepository hunterRepository;
    private final ThresholdTables thresholdTables;
    private final LedgerLock ledgerLock;

    public BadgeServiceImpl(BadgeRegistry badgeRegistry,
                            BadgeGrantRepository badgeGrantRepository,
                            HunterRepository hunterRepository,
                            ThresholdTables thresholdTables,
                            LedgerLock ledgerLock) {
        this.badgeRegistry = badgeRegistry;
        this.badgeGrantRepository = badgeGrantRepository;
        this.hunterRepository = hunterRepository;
        this.thresholdTables = thresholdTables;
        this.ledgerLock = ledgerLock;
    }

    @Override
    public List<BadgeDefinitionDTO> getBadgeList() {
        return ledgerLock.read(() -> {
            long totalHunters = hunterRepository.count();
            final double finalTotalHunters = (totalHunters == 0) ? 1.0 : (double) totalHunters;

            // [badge_key, count]
            Map<String, Long> counts = new HashMap<>();
            for (Object[] row : badgeGrantRepository.countByBadgeKey()) {
                counts.put((String) row[0], ((Number) row[1]).longValue());
            }

            return badgeRegistry.all().stream()
                    .map(rule -> toDTO(rule, counts.getOrDefault(rule.getBadgeKey(), 0L), finalTotalHunters))
                    .collect(Collectors.toList());
        });
    }

    private BadgeDefinitionDTO toDTO(BadgeRule rule, long achievedCount, double totalHunters) {
        ProgressionProperties.BadgeStyle style = thresholdTables.styleFor(rule.getBadgeKey());
        return new BadgeDefinitionDTO(
                rule.getBadgeKey(),
                rule.getName(),
                rule.getCategory(),
                rule.getDescription(),
                style.getColor(),
                style.getLogo(),
                achievedCount,
                achievedCount / totalHunters);
    }
}
