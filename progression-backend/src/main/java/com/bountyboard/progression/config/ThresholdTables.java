package com.bountyboard.progression.config;

import com.bountyboard.progression.entity.ActionKind;
import com.bountyboard.progression.entity.Tier;
import com.bountyboard.progression.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 阈值表：动作→XP、金额→档位、XP→等级。
 * 纯数据，构造时一次性校验，任何不合法的配置都会让应用启动失败。
 */
@Component
public class ThresholdTables {

    private static final Logger log = LoggerFactory.getLogger(ThresholdTables.class);

    private static final ProgressionProperties.BadgeStyle DEFAULT_STYLE = new ProgressionProperties.BadgeStyle();

    private final Map<ActionKind, Integer> flatXp = new EnumMap<>(ActionKind.class);
    private final Map<Tier, Integer> submitXp = new EnumMap<>(Tier.class);
    private final Map<Tier, Integer> mergeXp = new EnumMap<>(Tier.class);
    private final BigDecimal microMax;
    private final BigDecimal standardMax;
    private final BigDecimal majorMax;
    private final List<LevelEntry> levels;
    private final Map<String, ProgressionProperties.BadgeStyle> badgeStyles;

    public ThresholdTables(ProgressionProperties properties) {
        for (Map.Entry<String, Integer> e : properties.getFlatXp().entrySet()) {
            ActionKind kind = ActionKind.fromWire(e.getKey())
                    .orElseThrow(() -> new ConfigurationException("flat-xp: unknown action kind '" + e.getKey() + "'"));
            if (kind.isTierClassified()) {
                throw new ConfigurationException("flat-xp: " + kind.getWireName() + " is tier classified, use submit-xp / merge-xp");
            }
            flatXp.put(kind, requireNonNegative("flat-xp." + e.getKey(), e.getValue()));
        }
        for (ActionKind kind : ActionKind.values()) {
            if (!kind.isTierClassified() && !flatXp.containsKey(kind)) {
                throw new ConfigurationException("flat-xp: missing XP amount for " + kind.getWireName());
            }
        }
        loadTierTable("submit-xp", properties.getSubmitXp(), submitXp);
        loadTierTable("merge-xp", properties.getMergeXp(), mergeXp);

        ProgressionProperties.TierBands bands = properties.getTierBands();
        if (bands == null || bands.getMicroMax() == null || bands.getStandardMax() == null || bands.getMajorMax() == null) {
            throw new ConfigurationException("tier-bands: micro-max, standard-max and major-max are required");
        }
        if (bands.getMicroMax().signum() < 0
                || bands.getMicroMax().compareTo(bands.getStandardMax()) >= 0
                || bands.getStandardMax().compareTo(bands.getMajorMax()) >= 0) {
            throw new ConfigurationException("tier-bands: bounds must be non-negative and strictly increasing");
        }
        this.microMax = bands.getMicroMax();
        this.standardMax = bands.getStandardMax();
        this.majorMax = bands.getMajorMax();

        this.levels = Collections.unmodifiableList(loadLevels(properties.getLevels()));
        this.badgeStyles = new HashMap<>(properties.getBadgeStyles());

        log.info("Threshold tables loaded: {} flat actions, {} levels (max L{} at {} XP).",
                flatXp.size(), levels.size(), maxLevel().level(), maxLevel().minXp());
    }

    /**
     * 金额分档。调用方保证 amount 非空且非负
     */
    public Tier classify(BigDecimal amount) {
        if (amount.compareTo(microMax) <= 0) {
            return Tier.MICRO;
        }
        if (amount.compareTo(standardMax) <= 0) {
            return Tier.STANDARD;
        }
        if (amount.compareTo(majorMax) <= 0) {
            return Tier.MAJOR;
        }
        return Tier.CRITICAL;
    }

    /**
     * 查 XP。分档动作必须给出 tier；表中不存在的组合返回 empty
     */
    public Optional<Integer> xpFor(ActionKind kind, Tier tier) {
        if (kind == ActionKind.PR_SUBMITTED) {
            return Optional.ofNullable(tier == null ? null : submitXp.get(tier));
        }
        if (kind == ActionKind.PR_MERGED) {
            return Optional.ofNullable(tier == null ? null : mergeXp.get(tier));
        }
        return Optional.ofNullable(flatXp.get(kind));
    }

    /**
     * 最高的 minXp ≤ xp 的等级
     */
    public LevelEntry levelFor(long xp) {
        LevelEntry current = levels.get(0);
        for (LevelEntry entry : levels) {
            if (entry.minXp() <= xp) {
                current = entry;
            } else {
                break;
            }
        }
        return current;
    }

    /**
     * 下一等级，已是最高等级时为 empty
     */
    public Optional<LevelEntry> nextLevel(LevelEntry current) {
        int idx = levels.indexOf(current);
        if (idx < 0 || idx + 1 >= levels.size()) {
            return Optional.empty();
        }
        return Optional.of(levels.get(idx + 1));
    }

    public LevelEntry maxLevel() {
        return levels.get(levels.size() - 1);
    }

    public List<LevelEntry> levels() {
        return levels;
    }

    public ProgressionProperties.BadgeStyle styleFor(String badgeKey) {
        return badgeStyles.getOrDefault(badgeKey, DEFAULT_STYLE);
    }

    private static void loadTierTable(String name, Map<String, Integer> source, Map<Tier, Integer> target) {
        for (Map.Entry<String, Integer> e : source.entrySet()) {
            Tier tier;
            try {
                tier = Tier.valueOf(e.getKey().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException(name + ": unknown tier '" + e.getKey() + "'");
            }
            target.put(tier, requireNonNegative(name + "." + e.getKey(), e.getValue()));
        }
        for (Tier tier : Tier.values()) {
            if (!target.containsKey(tier)) {
                throw new ConfigurationException(name + ": missing XP amount for tier " + tier);
            }
        }
    }

    private static List<LevelEntry> loadLevels(List<ProgressionProperties.LevelThreshold> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new ConfigurationException("levels: at least one level is required");
        }
        List<LevelEntry> result = new ArrayList<>();
        LevelEntry previous = null;
        for (ProgressionProperties.LevelThreshold t : raw) {
            if (t.getTitle() == null || t.getTitle().isBlank()) {
                throw new ConfigurationException("levels: level " + t.getLevel() + " has no title");
            }
            LevelEntry entry = new LevelEntry(t.getMinXp(), t.getLevel(), t.getTitle(), t.getPerk() == null ? "" : t.getPerk());
            if (previous == null) {
                if (entry.minXp() != 0) {
                    throw new ConfigurationException("levels: the first level must start at 0 XP");
                }
            } else if (entry.minXp() <= previous.minXp() || entry.level() <= previous.level()) {
                throw new ConfigurationException("levels: thresholds must be strictly increasing (level "
                        + previous.level() + " -> " + entry.level() + ")");
            }
            result.add(entry);
            previous = entry;
        }
        return result;
    }

    private static int requireNonNegative(String name, Integer value) {
        if (value == null || value < 0) {
            throw new ConfigurationException(name + ": XP amount must be a non-negative integer");
        }
        return value;
    }

    /**
     * 等级表中的一行
     */
    public record LevelEntry(long minXp, int level, String title, String perk) {
    }
}
