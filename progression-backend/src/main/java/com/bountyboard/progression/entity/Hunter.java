package com.bountyboard.progression.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Hunter Entity: 悬赏猎人的缓存快照。
 * 除身份信息外，所有字段都可以由 award 表重放得到；award 表才是唯一事实来源。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "hunter")
public class Hunter {

    /**
     * 规范化后的 handle（去掉前导 @，小写），主键
     */
    @Id
    @Column(name = "hunter_id", length = 100)
    private String hunterId;

    /**
     * 首次出现时的原始 handle，用于展示
     */
    @Column(name = "handle", nullable = false, length = 100)
    private String handle;

    /**
     * 钱包引用，不做校验
     */
    @Column(name = "wallet_ref", length = 200)
    private String walletRef;

    /**
     * 累计 XP 缓存，必须恒等于该猎人全部 award 的 xp 之和
     */
    @Column(name = "cumulative_xp", nullable = false)
    private long cumulativeXp;

    @Column(name = "hunter_level", nullable = false)
    private int level;

    @Column(name = "level_title", nullable = false, length = 50)
    private String title;

    /**
     * 所有 award 中最早的时间戳（不是第一条写入的），排行榜平局时使用
     */
    @Column(name = "first_award_time", nullable = false)
    private LocalDateTime firstAwardTime;

    @Column(name = "last_action_time", nullable = false)
    private LocalDateTime lastActionTime;

    @Column(name = "last_action_summary", nullable = false, length = 300)
    private String lastActionSummary;

    @Column(name = "created_time", nullable = false)
    private LocalDateTime createdTime;
}
