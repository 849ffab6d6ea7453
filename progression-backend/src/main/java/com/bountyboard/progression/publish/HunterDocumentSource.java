package com.bountyboard.progression.publish;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.SortedSet;

/**
 * 生成单个猎人徽章文档所需的数据，取自同一次提交后的快照
 */
@Value
@Builder
public class HunterDocumentSource {

    String hunterId;
    String slug;
    String handle;
    long xp;
    int level;
    String title;

    // 已获得的徽章 key
    SortedSet<String> earnedBadges;

    // 已完成的悬赏数（合并的 PR、被接受的教程 / bug / 推广 / 老硬件证明）
    int completedCount;

    BigDecimal rtcEarned;

    LocalDateTime firstAwardTime;
    LocalDateTime lastActionTime;

    /**
     * 快照版本：该猎人当时的 award 条数。award 只增不减，旧快照不会覆盖新快照
     */
    long version;
}
