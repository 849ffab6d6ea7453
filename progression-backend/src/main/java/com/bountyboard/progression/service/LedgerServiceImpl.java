package com.bountyboard.progression.service;

import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.dto.AwardRecordDTO;
import com.bountyboard.progression.dto.BackfillRejectionDTO;
import com.bountyboard.progression.dto.BackfillReportDTO;
import com.bountyboard.progression.dto.HunterDriftDTO;
import com.bountyboard.progression.dto.HunterStateDTO;
import com.bountyboard.progression.dto.LedgerExportDTO;
import com.bountyboard.progression.dto.LedgerVerificationDTO;
import com.bountyboard.progression.dto.RecomputeReportDTO;
import com.bountyboard.progression.entity.Award;
import com.bountyboard.progression.entity.BadgeGrant;
import com.bountyboard.progression.entity.Hunter;
import com.bountyboard.progression.exception.DuplicateEventException;
import com.bountyboard.progression.exception.ErrorKind;
import com.bountyboard.progression.exception.HunterNotFoundException;
import com.bountyboard.progression.exception.ProgressionException;
import com.bountyboard.progression.publish.BadgePublishService;
import com.bountyboard.progression.publish.HunterDocumentSource;
import com.bountyboard.progression.repository.AwardRepository;
import com.bountyboard.progression.repository.BadgeGrantRepository;
import com.bountyboard.progression.repository.HunterRepository;
import com.bountyboard.progression.util.HunterIds;
import com.bountyboard.progression.util.ProgressBar;
import com.bountyboard.progression.util.RebuildStatusManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * XP 账本实现。
 * award 表是唯一事实来源，hunter / badge_grant 是可由重放得到的缓存。
 * 所有写操作在账本写锁内执行一个完整事务；徽章文档在提交后异步发布。
 */
@Slf4j
@Service
public class LedgerServiceImpl implements LedgerService {

    private static final String IDEMPOTENCY_CONSTRAINT = "uk_award_idempotency_key";

    private final AwardIngestor awardIngestor;
    private final ProgressionEvaluator evaluator;
    private final AwardRepository awardRepository;
    private final HunterRepository hunterRepository;
    private final BadgeGrantRepository badgeGrantRepository;
    private final HunterStateAssembler assembler;
    private final BadgePublishService publishService;
    private final RebuildStatusManager rebuildStatusManager;
    private final LedgerLock ledgerLock;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public LedgerServiceImpl(AwardIngestor awardIngestor,
                             ProgressionEvaluator evaluator,
                             AwardRepository awardRepository,
                             HunterRepository hunterRepository,
                             BadgeGrantRepository badgeGrantRepository,
                             HunterStateAssembler assembler,
                             BadgePublishService publishService,
                             RebuildStatusManager rebuildStatusManager,
                             LedgerLock ledgerLock,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.awardIngestor = awardIngestor;
        this.evaluator = evaluator;
        this.awardRepository = awardRepository;
        this.hunterRepository = hunterRepository;
        this.badgeGrantRepository = badgeGrantRepository;
        this.assembler = assembler;
        this.publishService = publishService;
        this.rebuildStatusManager = rebuildStatusManager;
        this.ledgerLock = ledgerLock;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.clock = clock;
    }

    // ------------------------------------------------------------------ append

    @Override
    public HunterStateDTO append(AwardEventDTO event) {
        WriteResult<HunterStateDTO> result = ledgerLock.write(() -> writeTx.execute(status -> doAppend(event)));
        result.sources().forEach(publishService::publishHunter);
        publishService.publishBoard();
        return result.value();
    }

    private WriteResult<HunterStateDTO> doAppend(AwardEventDTO event) {
        Award award = awardIngestor.ingest(event, false);
        try {
            award = awardRepository.saveAndFlush(award);
        } catch (DataIntegrityViolationException e) {
            if (!isIdempotencyKeyViolation(e)) {
                throw e;
            }
            // 幂等检查之后仍然撞上唯一约束，说明另一个写入者先提交了同一事件
            log.info("重复事件被唯一约束拦截: hunter={}, source={}, cause={}",
                    award.getHunterId(), award.getSourceRef(), e.getMostSpecificCause().getMessage());
            throw new DuplicateEventException(award.getIdempotencyKey(), award.getSourceRef());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String hunterId = award.getHunterId();
        Hunter hunter = hunterRepository.findById(hunterId).orElse(null);
        int previousLevel = 0;
        if (hunter == null) {
            hunter = newHunter(hunterId, HunterIds.displayHandle(event.getHunterId()), now);
            hunter.setFirstAwardTime(award.getOccurredTime());
            hunter.setLastActionTime(award.getOccurredTime());
            hunter.setLastActionSummary(HunterStateAssembler.summarize(award));
            log.info("新猎人加入: {}", hunterId);
        } else {
            previousLevel = hunter.getLevel();
        }
        if (event.getWalletRef() != null && !event.getWalletRef().isBlank()) {
            hunter.setWalletRef(event.getWalletRef().trim());
        }

        // 增量更新
        hunter.setCumulativeXp(hunter.getCumulativeXp() + award.getXpAmount());
        if (award.getOccurredTime().isBefore(hunter.getFirstAwardTime())) {
            hunter.setFirstAwardTime(award.getOccurredTime());
        }
        if (!award.getOccurredTime().isBefore(hunter.getLastActionTime())) {
            hunter.setLastActionTime(award.getOccurredTime());
            hunter.setLastActionSummary(HunterStateAssembler.summarize(award));
        }

        // 与完整重放对账，两者必须一致
        List<Award> history = awardRepository.findByHunterIdOrderByAwardIdAsc(hunterId);
        ProgressionEvaluator.Evaluation evaluation = evaluator.evaluate(hunterId, hunter.getHandle(), history);
        if (evaluation.cumulativeXp() != hunter.getCumulativeXp()
                || !Objects.equals(evaluation.firstAwardTime(), hunter.getFirstAwardTime())) {
            log.error("猎人 {} 的缓存与重放结果不一致 (cached xp={}, replayed xp={})，以重放结果为准",
                    hunterId, hunter.getCumulativeXp(), evaluation.cumulativeXp());
        }
        Applied applied = applyEvaluation(hunter, evaluation, false, now);

        if (hunter.getLevel() > previousLevel && previousLevel > 0) {
            log.info("猎人 {} 升级: L{} -> L{} ({})", hunterId, previousLevel, hunter.getLevel(), hunter.getTitle());
        }
        log.info("Award recorded: hunter={}, action={}, xp=+{}, total={}, source={}",
                hunterId, award.getActionKind().getWireName(), award.getXpAmount(),
                hunter.getCumulativeXp(), award.getSourceRef());

        List<BadgeGrant> grants = badgeGrantRepository.findByHunterIdOrderByQualifyingTimeAscBadgeKeyAsc(hunterId);
        HunterStateDTO state = assembler.toState(hunter, grants);
        state.setNewlyGrantedBadges(applied.newlyGranted());
        state.setAward(assembler.toRecord(award));
        return new WriteResult<>(state, List.of(assembler.toDocumentSource(hunter, history, grants)));
    }

    /**
     * 只有 award 幂等键的唯一约束冲突才算重复事件，其余完整性错误照常抛出
     */
    static boolean isIdempotencyKeyViolation(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(IDEMPOTENCY_CONSTRAINT);
    }

    // ---------------------------------------------------------------- backfill

    @Override
    public BackfillReportDTO backfill(List<AwardEventDTO> events) {
        List<AwardEventDTO> batch = events == null ? List.of() : events;
        WriteResult<BackfillReportDTO> result;
        rebuildStatusManager.enterRebuild();
        try {
            result = ledgerLock.write(() -> writeTx.execute(status -> doBackfill(batch)));
        } finally {
            rebuildStatusManager.exitRebuild();
        }
        result.sources().forEach(publishService::publishHunter);
        publishService.publishBoard();
        return result.value();
    }

    private WriteResult<BackfillReportDTO> doBackfill(List<AwardEventDTO> batch) {
        log.info("Backfill started: {} entries.", batch.size());
        BackfillReportDTO report = new BackfillReportDTO();
        report.setReceived(batch.size());

        Set<String> batchKeys = new HashSet<>();
        // 每个猎人在批次中第一次出现时的 handle / 钱包
        Map<String, String> handles = new HashMap<>();
        Map<String, String> wallets = new HashMap<>();

        ProgressBar progressBar = new ProgressBar("账本回填", batch.size());
        for (int i = 0; i < batch.size(); i++) {
            AwardEventDTO event = batch.get(i);
            try {
                Award award = awardIngestor.ingest(event, true);
                if (!batchKeys.add(award.getIdempotencyKey())) {
                    throw new DuplicateEventException(award.getIdempotencyKey(), award.getSourceRef());
                }
                awardRepository.save(award);
                report.setAccepted(report.getAccepted() + 1);
                if (award.isDegraded()) {
                    report.setDegraded(report.getDegraded() + 1);
                }
                handles.putIfAbsent(award.getHunterId(), HunterIds.displayHandle(event.getHunterId()));
                if (event.getWalletRef() != null && !event.getWalletRef().isBlank()) {
                    wallets.putIfAbsent(award.getHunterId(), event.getWalletRef().trim());
                }
            } catch (ProgressionException e) {
                if (e.getKind() == ErrorKind.DUPLICATE_EVENT) {
                    report.setDuplicates(report.getDuplicates() + 1);
                } else {
                    report.setRejected(report.getRejected() + 1);
                }
                report.getRejections().add(new BackfillRejectionDTO(
                        i, event == null ? null : event.getSourceRef(), e.getKind().name(), e.getMessage()));
                log.debug("回填条目 #{} 被跳过: {}", i, e.getMessage());
            }
            progressBar.step();
        }
        progressBar.complete();

        LocalDateTime now = LocalDateTime.now(clock);
        RecomputeReportDTO recompute = new RecomputeReportDTO();
        List<HunterDocumentSource> sources = new ArrayList<>();
        for (String hunterId : new TreeSet<>(handles.keySet())) {
            Hunter hunter = hunterRepository.findById(hunterId)
                    .orElseGet(() -> newHunter(hunterId, handles.get(hunterId), now));
            if (hunter.getWalletRef() == null && wallets.containsKey(hunterId)) {
                hunter.setWalletRef(wallets.get(hunterId));
            }
            sources.add(recomputeHunter(hunter, recompute, now));
        }
        report.setAffectedHunters(new ArrayList<>(new TreeSet<>(handles.keySet())));

        log.info("Backfill finished: received={}, accepted={}, duplicates={}, rejected={}, degraded={}, hunters={}, badges granted={}",
                report.getReceived(), report.getAccepted(), report.getDuplicates(), report.getRejected(),
                report.getDegraded(), handles.size(), recompute.getBadgesGranted());
        return new WriteResult<>(report, sources);
    }

    // --------------------------------------------------------------- recompute

    @Override
    public RecomputeReportDTO recompute(String hunterId) {
        String id = HunterIds.normalize(hunterId);
        WriteResult<RecomputeReportDTO> result = ledgerLock.write(() -> writeTx.execute(status -> {
            Hunter hunter = hunterRepository.findById(id)
                    .orElseThrow(() -> new HunterNotFoundException(hunterId));
            RecomputeReportDTO report = new RecomputeReportDTO();
            HunterDocumentSource source = recomputeHunter(hunter, report, LocalDateTime.now(clock));
            return new WriteResult<>(report, List.of(source));
        }));
        result.sources().forEach(publishService::publishHunter);
        publishService.publishBoard();
        return result.value();
    }

    /**
     * 全量 catch-up：重建所有猎人的缓存，并补发运行期新注册的徽章
     */
    @Override
    public RecomputeReportDTO recomputeAll() {
        WriteResult<RecomputeReportDTO> result;
        rebuildStatusManager.enterRebuild();
        try {
            result = ledgerLock.write(() -> writeTx.execute(status -> {
                log.info("Full recompute started.");
                List<Hunter> hunters = hunterRepository.findAll();
                hunters.sort(Comparator.comparing(Hunter::getHunterId));
                ProgressBar progressBar = new ProgressBar("全量重算", hunters.size());
                RecomputeReportDTO report = new RecomputeReportDTO();
                List<HunterDocumentSource> sources = new ArrayList<>();
                LocalDateTime now = LocalDateTime.now(clock);
                for (Hunter hunter : hunters) {
                    sources.add(recomputeHunter(hunter, report, now));
                    progressBar.step();
                }
                progressBar.complete();
                log.info("Full recompute finished: hunters={}, xp corrections={}, level corrections={}, badges granted={}",
                        report.getHuntersRecomputed(), report.getXpCorrections(),
                        report.getLevelCorrections(), report.getBadgesGranted());
                return new WriteResult<>(report, sources);
            }));
        } finally {
            rebuildStatusManager.exitRebuild();
        }
        result.sources().forEach(publishService::publishHunter);
        publishService.publishBoard();
        return result.value();
    }

    private HunterDocumentSource recomputeHunter(Hunter hunter, RecomputeReportDTO report, LocalDateTime now) {
        List<Award> history = awardRepository.findByHunterIdOrderByAwardIdAsc(hunter.getHunterId());
        ProgressionEvaluator.Evaluation evaluation = evaluator.evaluate(hunter.getHunterId(), hunter.getHandle(), history);
        Applied applied = applyEvaluation(hunter, evaluation, true, now);
        report.setHuntersRecomputed(report.getHuntersRecomputed() + 1);
        if (applied.xpCorrected()) {
            report.setXpCorrections(report.getXpCorrections() + 1);
        }
        if (applied.levelCorrected()) {
            report.setLevelCorrections(report.getLevelCorrections() + 1);
        }
        report.setBadgesGranted(report.getBadgesGranted() + applied.newlyGranted().size());
        List<BadgeGrant> grants = badgeGrantRepository.findByHunterIdOrderByQualifyingTimeAscBadgeKeyAsc(hunter.getHunterId());
        return assembler.toDocumentSource(hunter, history, grants);
    }

    /**
     * 用重放结果覆盖猎人缓存，并记录尚未授予的徽章（只增不减）
     */
    private Applied applyEvaluation(Hunter hunter, ProgressionEvaluator.Evaluation evaluation,
                                    boolean retroactive, LocalDateTime now) {
        boolean isNew = hunter.getTitle() == null;
        boolean xpCorrected = !isNew && hunter.getCumulativeXp() != evaluation.cumulativeXp();
        boolean levelCorrected = !isNew && hunter.getLevel() != evaluation.level().level();

        hunter.setCumulativeXp(evaluation.cumulativeXp());
        hunter.setLevel(evaluation.level().level());
        hunter.setTitle(evaluation.level().title());
        hunter.setFirstAwardTime(evaluation.firstAwardTime());
        hunter.setLastActionTime(evaluation.lastAction().getOccurredTime());
        hunter.setLastActionSummary(HunterStateAssembler.summarize(evaluation.lastAction()));
        hunterRepository.save(hunter);

        Set<String> granted = badgeGrantRepository.findByHunterIdOrderByQualifyingTimeAscBadgeKeyAsc(hunter.getHunterId())
                .stream().map(BadgeGrant::getBadgeKey).collect(Collectors.toSet());
        List<String> newlyGranted = new ArrayList<>();
        for (Map.Entry<String, LocalDateTime> e : evaluation.badgeQualifyingTimes().entrySet()) {
            if (granted.contains(e.getKey())) {
                continue;
            }
            badgeGrantRepository.save(new BadgeGrant(null, hunter.getHunterId(), e.getKey(), e.getValue(), now, retroactive));
            newlyGranted.add(e.getKey());
            log.info("徽章授予: hunter={}, badge={}, qualifying={}{}",
                    hunter.getHunterId(), e.getKey(), e.getValue(), retroactive ? " (retroactive)" : "");
        }
        if (xpCorrected) {
            log.warn("猎人 {} 的 XP 缓存已修正为 {}", hunter.getHunterId(), evaluation.cumulativeXp());
        }
        return new Applied(xpCorrected, levelCorrected, newlyGranted);
    }

    private Hunter newHunter(String hunterId, String handle, LocalDateTime now) {
        Hunter hunter = new Hunter();
        hunter.setHunterId(hunterId);
        hunter.setHandle(handle == null || handle.isEmpty() ? hunterId : handle);
        hunter.setCreatedTime(now);
        return hunter;
    }

    // ------------------------------------------------------------------- reads

    @Override
    public LedgerVerificationDTO verify() {
        return ledgerLock.read(() -> readTx.execute(status -> {
            List<Award> awards = awardRepository.findAllByOrderByAwardIdAsc();
            Map<String, List<Award>> awardsByHunter = awards.stream()
                    .collect(Collectors.groupingBy(Award::getHunterId, TreeMap::new, Collectors.toList()));
            Map<String, Set<String>> grantsByHunter = badgeGrantRepository.findAll().stream()
                    .collect(Collectors.groupingBy(BadgeGrant::getHunterId,
                            Collectors.mapping(BadgeGrant::getBadgeKey, Collectors.toSet())));
            Map<String, Hunter> hunters = hunterRepository.findAll().stream()
                    .collect(Collectors.toMap(Hunter::getHunterId, Function.identity(), (a, b) -> a, TreeMap::new));

            List<HunterDriftDTO> drifts = new ArrayList<>();
            for (Hunter hunter : hunters.values()) {
                List<Award> history = awardsByHunter.getOrDefault(hunter.getHunterId(), List.of());
                ProgressionEvaluator.Evaluation evaluation =
                        evaluator.evaluate(hunter.getHunterId(), hunter.getHandle(), history);
                Set<String> granted = grantsByHunter.getOrDefault(hunter.getHunterId(), Set.of());
                List<String> missing = evaluation.badgeQualifyingTimes().keySet().stream()
                        .filter(key -> !granted.contains(key))
                        .sorted()
                        .collect(Collectors.toList());
                if (hunter.getCumulativeXp() != evaluation.cumulativeXp()
                        || hunter.getLevel() != evaluation.level().level()
                        || !Objects.equals(hunter.getFirstAwardTime(), evaluation.firstAwardTime())
                        || !missing.isEmpty()) {
                    drifts.add(HunterDriftDTO.builder()
                            .hunterId(hunter.getHunterId())
                            .cachedXp(hunter.getCumulativeXp())
                            .replayedXp(evaluation.cumulativeXp())
                            .cachedLevel(hunter.getLevel())
                            .replayedLevel(evaluation.level().level())
                            .cachedFirstAwardTime(hunter.getFirstAwardTime())
                            .replayedFirstAwardTime(evaluation.firstAwardTime())
                            .missingBadges(missing)
                            .build());
                }
            }
            // 有 award 却没有猎人记录
            for (Map.Entry<String, List<Award>> e : awardsByHunter.entrySet()) {
                if (hunters.containsKey(e.getKey())) {
                    continue;
                }
                ProgressionEvaluator.Evaluation evaluation = evaluator.evaluate(e.getKey(), e.getKey(), e.getValue());
                drifts.add(HunterDriftDTO.builder()
                        .hunterId(e.getKey())
                        .replayedXp(evaluation.cumulativeXp())
                        .replayedLevel(evaluation.level().level())
                        .replayedFirstAwardTime(evaluation.firstAwardTime())
                        .missingBadges(new ArrayList<>(new TreeSet<>(evaluation.badgeQualifyingTimes().keySet())))
                        .build());
            }

            if (!drifts.isEmpty()) {
                log.warn("账本校验发现 {} 个猎人的缓存与重放结果不一致", drifts.size());
            }
            return new LedgerVerificationDTO(hunters.size(), awards.size(), drifts.isEmpty(), drifts,
                    LocalDateTime.now(clock));
        }));
    }

    @Override
    public LedgerExportDTO export() {
        return ledgerLock.read(() -> readTx.execute(status -> {
            Map<String, Hunter> hunters = hunterRepository.findAll().stream()
                    .collect(Collectors.toMap(Hunter::getHunterId, Function.identity(), (a, b) -> a, TreeMap::new));
            Map<String, List<BadgeGrant>> grants = badgeGrantRepository.findAll().stream()
                    .sorted(Comparator.comparing(BadgeGrant::getQualifyingTime).thenComparing(BadgeGrant::getBadgeKey))
                    .collect(Collectors.groupingBy(BadgeGrant::getHunterId, LinkedHashMap::new, Collectors.toList()));

            List<AwardEventDTO> awards = awardRepository.findAllByOrderByAwardIdAsc().stream()
                    .map(a -> assembler.toEvent(a, hunters.get(a.getHunterId())))
                    .collect(Collectors.toList());
            List<HunterStateDTO> states = hunters.values().stream()
                    .map(h -> assembler.toState(h, grants.getOrDefault(h.getHunterId(), List.of())))
                    .collect(Collectors.toList());
            return new LedgerExportDTO(LocalDateTime.now(clock), awards, states);
        }));
    }

    @Override
    public List<AwardRecordDTO> degraded() {
        return ledgerLock.read(() -> readTx.execute(status -> awardRepository.findByDegradedTrueOrderByAwardIdAsc()
                .stream()
                .map(assembler::toRecord)
                .collect(Collectors.toList())));
    }

    @Override
    public int republishAll() {
        List<HunterDocumentSource> sources = ledgerLock.read(() -> readTx.execute(status -> {
            List<HunterDocumentSource> result = new ArrayList<>();
            for (Hunter hunter : hunterRepository.findAll()) {
                result.add(assembler.toDocumentSource(hunter,
                        awardRepository.findByHunterIdOrderByAwardIdAsc(hunter.getHunterId()),
                        badgeGrantRepository.findByHunterIdOrderByQualifyingTimeAscBadgeKeyAsc(hunter.getHunterId())));
            }
            return result;
        }));
        sources.forEach(publishService::publishHunterNow);
        publishService.publishBoardNow();
        log.info("Republished badge documents for {} hunters.", sources.size());
        return sources.size();
    }

    private record WriteResult<T>(T value, List<HunterDocumentSource> sources) {
    }

    private record Applied(boolean xpCorrected, boolean levelCorrected, List<String> newlyGranted) {
    }
}
