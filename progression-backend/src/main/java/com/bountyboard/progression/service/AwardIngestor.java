package com.bountyboard.progression.service;

import com.bountyboard.progression.config.ThresholdTables;
import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.entity.ActionKind;
import com.bountyboard.progression.entity.Award;
import com.bountyboard.progression.entity.Tier;
import com.bountyboard.progression.exception.DuplicateEventException;
import com.bountyboard.progression.exception.InvalidAwardEventException;
import com.bountyboard.progression.exception.UnknownActionKindException;
import com.bountyboard.progression.repository.AwardRepository;
import com.bountyboard.progression.util.HunterIds;
import com.bountyboard.progression.util.IdempotencyKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 把触发方的原始事件校验、分档，转换为一条尚未保存的 Award。
 * 拒绝时抛出异常，不产生任何副作用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AwardIngestor {

    // 与 award / hunter 表的列宽一致
    static final int MAX_HUNTER_ID_LENGTH = 100;
    static final int MAX_SOURCE_REF_LENGTH = 200;
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 128;
    static final int MAX_WALLET_REF_LENGTH = 200;
    // reference_amount 为 DECIMAL(18,4)
    static final int AMOUNT_SCALE = 4;
    static final int MAX_AMOUNT_INTEGER_DIGITS = 14;

    private final ThresholdTables thresholdTables;
    private final AwardRepository awardRepository;
    private final Clock clock;

    /**
     * @param event    原始事件
     * @param backfill 是否为回填条目（回填必须带时间戳）
     */
    public Award ingest(AwardEventDTO event, boolean backfill) {
        if (event == null) {
            throw new InvalidAwardEventException("Event body is required");
        }
        String hunterId = HunterIds.normalize(event.getHunterId());
        if (hunterId.isEmpty()) {
            throw new InvalidAwardEventException("hunterId is required (source " + event.getSourceRef() + ")");
        }
        if (event.getSourceRef() == null || event.getSourceRef().isBlank()) {
            throw new InvalidAwardEventException("sourceRef is required (hunter " + hunterId + ")");
        }
        if (HunterIds.displayHandle(event.getHunterId()).length() > MAX_HUNTER_ID_LENGTH) {
            throw new InvalidAwardEventException("hunterId is longer than " + MAX_HUNTER_ID_LENGTH + " characters");
        }
        String sourceRef = event.getSourceRef().trim();
        if (sourceRef.length() > MAX_SOURCE_REF_LENGTH) {
            throw new InvalidAwardEventException("sourceRef is longer than " + MAX_SOURCE_REF_LENGTH
                    + " characters (hunter " + hunterId + ")");
        }
        if (event.getWalletRef() != null && event.getWalletRef().trim().length() > MAX_WALLET_REF_LENGTH) {
            throw new InvalidAwardEventException("walletRef is longer than " + MAX_WALLET_REF_LENGTH
                    + " characters (source " + sourceRef + ")");
        }
        if (backfill && event.getTimestamp() == null) {
            throw new InvalidAwardEventException("timestamp is required for backfill entries (source " + sourceRef + ")");
        }

        ActionKind kind = ActionKind.fromWire(event.getActionKind()).orElse(null);
        if (kind == null) {
            log.warn("未知的动作类型 '{}'，事件被拒绝: hunter={}, source={}", event.getActionKind(), hunterId, sourceRef);
            throw new UnknownActionKindException(event.getActionKind(), sourceRef);
        }

        String key = event.getIdempotencyKey() != null && !event.getIdempotencyKey().isBlank()
                ? event.getIdempotencyKey().trim()
                : IdempotencyKeys.compute(hunterId, kind, sourceRef);
        if (key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new InvalidAwardEventException("idempotencyKey is longer than " + MAX_IDEMPOTENCY_KEY_LENGTH
                    + " characters (source " + sourceRef + ")");
        }
        if (awardRepository.existsByIdempotencyKey(key)) {
            log.info("重复事件已忽略: hunter={}, action={}, source={}", hunterId, kind.getWireName(), sourceRef);
            throw new DuplicateEventException(key, sourceRef);
        }

        BigDecimal amount = parseAmount(event.getReferenceAmount());
        Tier tier = null;
        boolean degraded = false;
        if (kind.isTierClassified()) {
            if (amount == null || amount.signum() < 0 || !fitsColumn(amount)) {
                log.warn("金额无法识别或超出范围 '{}'，按 MICRO 档处理并标记待复核: hunter={}, action={}, source={}",
                        event.getReferenceAmount(), hunterId, kind.getWireName(), sourceRef);
                tier = Tier.MICRO;
                degraded = true;
                amount = null;
            } else {
                tier = thresholdTables.classify(amount);
            }
        }
        int xp = thresholdTables.xpFor(kind, tier)
                .orElseThrow(() -> new UnknownActionKindException(kind.getWireName(), sourceRef));

        LocalDateTime now = LocalDateTime.now(clock);
        Award award = new Award();
        award.setHunterId(hunterId);
        award.setActionKind(kind);
        award.setReferenceAmount(amount);
        award.setTier(tier);
        award.setXpAmount(xp);
        award.setSourceRef(sourceRef);
        award.setOccurredTime(event.getTimestamp() != null ? event.getTimestamp() : now);
        award.setRecordedTime(now);
        award.setIdempotencyKey(key);
        award.setDegraded(degraded);
        award.setBackfilled(backfill);
        award.setReason(describe(kind, tier, degraded));
        return award;
    }

    /**
     * 解析 "25"、"25.5"、"25 RTC"。无法解析时返回 null
     */
    static BigDecimal parseAmount(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.toUpperCase(Locale.ROOT).endsWith("RTC")) {
            value = value.substring(0, value.length() - 3).trim();
        }
        if (value.isEmpty()) {
            return null;
        }
        try {
            BigDecimal amount = new BigDecimal(value);
            return amount.scale() > AMOUNT_SCALE ? amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP) : amount;
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /**
     * 超出 DECIMAL(18,4) 整数位的金额无法保存，按格式错误处理
     */
    static boolean fitsColumn(BigDecimal amount) {
        return amount.precision() - amount.scale() <= MAX_AMOUNT_INTEGER_DIGITS;
    }

    static String describe(ActionKind kind, Tier tier, boolean degraded) {
        String base;
        switch (kind) {
            case CLAIM:
                base = "Bounty claimed";
                break;
            case PR_SUBMITTED:
                base = "PR submitted, " + tier.name().toLowerCase(Locale.ROOT) + " tier";
                break;
            case PR_MERGED:
                base = "PR merged, " + tier.name().toLowerCase(Locale.ROOT) + " tier";
                break;
            case TUTORIAL_ACCEPTED:
                base = "Tutorial accepted";
                break;
            case BUG_ACCEPTED:
                base = "Bug report accepted";
                break;
            case OUTREACH_ACCEPTED:
                base = "Outreach accepted";
                break;
            case VINTAGE_PROOF:
                base = "Vintage hardware proof";
                break;
            case FIRST_COMPLETION_BONUS:
                base = "First completion bonus";
                break;
            default:
                base = kind.getWireName();
        }
        return degraded ? base + " (amount unverified)" : base;
    }
}
