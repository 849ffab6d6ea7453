package com.bountyboard.progression.service;

import com.bountyboard.progression.badge.BadgeRegistry;
import com.bountyboard.progression.config.ThresholdTables;
import com.bountyboard.progression.dto.BoardSummaryDTO;
import com.bountyboard.progression.dto.HunterProfileDTO;
import com.bountyboard.progression.dto.LeaderboardEntryDTO;
import com.bountyboard.progression.entity.BadgeGrant;
import com.bountyboard.progression.entity.Hunter;
import com.bountyboard.progression.exception.HunterNotFoundException;
import com.bountyboard.progression.repository.AwardRepository;
import com.bountyboard.progression.repository.BadgeGrantRepository;
import com.bountyboard.progression.repository.HunterRepository;
import com.bountyboard.progression.util.HunterIds;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 排行榜：读模型，每次从缓存快照全量重排，不单独持久化
 */
@Service
public class LeaderboardServiceImpl implements LeaderboardService {

    static final Comparator<Hunter> RANKING_ORDER = Comparator
            .comparingLong(Hunter::getCumulativeXp).reversed()
            .thenComparing(Hunter::getFirstAwardTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Hunter::getHunterId);

    private final HunterRepository hunterRepository;
    private final BadgeGrantRepository badgeGrantRepository;
    private final AwardRepository awardRepository;
    private final BadgeRegistry badgeRegistry;
    private final ThresholdTables thresholdTables;
    private final HunterStateAssembler assembler;
    private final LedgerLock ledgerLock;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public LeaderboardServiceImpl(HunterRepository hunterRepository,
                                  BadgeGrantRepository badgeGrantRepository,
                                  AwardRepository awardRepository,
                                  BadgeRegistry badgeRegistry,
                                  ThresholdTables thresholdTables,
                                  HunterStateAssembler assembler,
                                  LedgerLock ledgerLock,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock) {
        this.hunterRepository = hunterRepository;
        this.badgeGrantRepository = badgeGrantRepository;
        this.awardRepository = awardRepository;
        this.badgeRegistry = badgeRegistry;
        this.thresholdTables = thresholdTables;
        this.assembler = assembler;
        this.ledgerLock = ledgerLock;
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.clock = clock;
    }

    @Override
    public List<LeaderboardEntryDTO> render(List<Hunter> hunters, Map<String, List<String>> badgeNames) {
        List<Hunter> sorted = new ArrayList<>(hunters);
        sorted.sort(RANKING_ORDER);

        List<LeaderboardEntryDTO> rows = new ArrayList<>(sorted.size());
        int rank = 1;
        for (Hunter h : sorted) {
            List<String> badges = new ArrayList<>(badgeNames.getOrDefault(h.getHunterId(), List.of()));
            badges.sort(Comparator.naturalOrder());
            rows.add(new LeaderboardEntryDTO(
                    rank++,
                    h.getHunterId(),
                    h.getHandle(),
                    h.getWalletRef(),
                    h.getCumulativeXp(),
                    h.getLevel(),
                    h.getTitle(),
                    badges,
                    h.getLastActionSummary()));
        }
        return rows;
    }

    @Override
    public List<LeaderboardEntryDTO> getLeaderboard(Integer count) {
        List<LeaderboardEntryDTO> rows = ledgerLock.read(() -> readTx.execute(status -> renderAll()));
        if (count == null || count <= 0 || count >= rows.size()) {
            return rows;
        }
        return new ArrayList<>(rows.subList(0, count));
    }

    @Override
    public BoardSummaryDTO getSummary() {
        return ledgerLock.read(() -> readTx.execute(status -> {
            List<LeaderboardEntryDTO> rows = renderAll();
            LocalDateTime now = LocalDateTime.now(clock);
            long totalXp = rows.stream().mapToLong(LeaderboardEntryDTO::getXp).sum();
            int maxLevel = thresholdTables.maxLevel().level();
            long legendary = rows.stream().filter(r -> r.getLevel() >= maxLevel).count();
            Long weekly = awardRepository.sumXpSince(now.minusDays(7));
            return new BoardSummaryDTO(
                    totalXp,
                    rows.size(),
                    legendary,
                    rows.isEmpty() ? null : rows.get(0),
                    new ArrayList<>(rows.subList(0, Math.min(3, rows.size()))),
                    weekly == null ? 0L : weekly,
                    now);
        }));
    }

    @Override
    public HunterProfileDTO getHunterProfile(String hunterId) {
        String id = HunterIds.normalize(hunterId);
        return ledgerLock.read(() -> readTx.execute(status -> {
            Hunter hunter = hunterRepository.findById(id)
                    .orElseThrow(() -> new HunterNotFoundException(hunterId));
            List<BadgeGrant> grants = badgeGrantRepository.findByHunterIdOrderByQualifyingTimeAscBadgeKeyAsc(id);
            int rank = renderAll().stream()
                    .filter(r -> r.getHunterId().equals(id))
                    .map(LeaderboardEntryDTO::getRank)
                    .findFirst()
                    .orElse(0);
            return new HunterProfileDTO(
                    assembler.toState(hunter, grants),
                    rank,
                    awardRepository.findByHunterIdOrderByAwardIdAsc(id).stream()
                            .map(assembler::toRecord)
                            .collect(Collectors.toList()));
        }));
    }

    private List<LeaderboardEntryDTO> renderAll() {
        Map<String, List<String>> badgeNames = badgeGrantRepository.findAll().stream()
                .collect(Collectors.groupingBy(BadgeGrant::getHunterId,
                        Collectors.mapping(g -> badgeRegistry.displayName(g.getBadgeKey()), Collectors.toList())));
        return render(hunterRepository.findAll(), badgeNames);
    }
}
