package com.bountyboard.progression.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 进度账本的静态配置：XP 表、档位区间、等级表、徽章样式、发布设置。
 * 默认值与悬赏看板公开的规则一致，application.yml 可覆盖。
 * 合法性校验由 {@link ThresholdTables} 在启动时完成。
 */
@Data
@ConfigurationProperties(prefix = "progression")
public class ProgressionProperties {

    /**
     * 固定 XP 的动作（key 为 wire 名称，如 tutorial-accepted）
     */
    private Map<String, Integer> flatXp = new LinkedHashMap<>(Map.of(
            "claim", 20,
            "tutorial-accepted", 150,
            "bug-accepted", 100,
            "outreach-accepted", 30,
            "vintage-proof", 100,
            "first-completion-bonus", 50));

    /**
     * PR 提交按档位给 XP（key 为档位名：micro / standard / major / critical）
     */
    private Map<String, Integer> submitXp = new LinkedHashMap<>(Map.of(
            "micro", 50,
            "standard", 100,
            "major", 200,
            "critical", 300));

    /**
     * PR 合并按档位给 XP。原始规则只给出 "+100 到 +500" 的区间，这里给出明确映射
     */
    private Map<String, Integer> mergeXp = new LinkedHashMap<>(Map.of(
            "micro", 100,
            "standard", 100,
            "major", 300,
            "critical", 500));

    /**
     * 档位上限（含），超过 major 上限即为 critical
     */
    private TierBands tierBands = new TierBands();

    private List<LevelThreshold> levels = new ArrayList<>(List.of(
            new LevelThreshold(0, 1, "Starting Hunter", "Can claim micro bounties"),
            new LevelThreshold(200, 2, "Basic Hunter", "Can claim standard bounties"),
            new LevelThreshold(500, 3, "Priority Hunter", "Priority review queue"),
            new LevelThreshold(1000, 4, "Rising Hunter", "Can claim major bounties"),
            new LevelThreshold(2000, 5, "Multiplier Hunter", "1.1x payout multiplier"),
            new LevelThreshold(3500, 6, "Featured Hunter", "Featured on the board"),
            new LevelThreshold(5500, 7, "Veteran Hunter", "Can claim critical bounties"),
            new LevelThreshold(8000, 8, "Elite Hunter", "Early access to new bounties"),
            new LevelThreshold(12000, 9, "Master Hunter", "Can mentor new hunters"),
            new LevelThreshold(18000, 10, "Legendary Hunter", "Hall of fame")));

    /**
     * 徽章文档样式（key 为 badgeKey）。未配置的徽章使用 blue / star / white
     */
    private Map<String, BadgeStyle> badgeStyles = new LinkedHashMap<>();

    private Publish publish = new Publish();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierBands {
        private BigDecimal microMax = new BigDecimal("10");
        private BigDecimal standardMax = new BigDecimal("50");
        private BigDecimal majorMax = new BigDecimal("100");
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LevelThreshold {
        private long minXp;
        private int level;
        private String title;
        private String perk;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BadgeStyle {
        private String color = "blue";
        private String logo = "star";
        private String logoColor = "white";
    }

    @Data
    public static class Publish {
        /**
         * 是否把徽章文档同时写到文件目录（供静态托管的 shields endpoint 使用）
         */
        private boolean fileSinkEnabled = false;
        private String outDir = "badges";
        /**
         * 看板级文档（总 XP、周增长等）的定时刷新间隔
         */
        private long boardRefreshMs = 60_000L;
        /**
         * 文件输出失败时的首次重试间隔，之后每次翻倍
         */
        private long retryDelayMs = 500L;
        /**
         * 启动完成后从账本重新生成全部徽章文档
         */
        private boolean republishOnStartup = true;
        private int executorCoreSize = 2;
        private int executorMaxSize = 4;
        private int executorQueueCapacity = 500;
    }
}
