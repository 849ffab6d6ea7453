package com.bountyboard.progression.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 徽章授予记录。永久记录，一经写入不再删除。
 * 同时保留"满足条件的 award 时间"和"实际写入时间"，由使用方自行选择展示哪一个。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "badge_grant",
        uniqueConstraints = @UniqueConstraint(name = "uk_badge_grant_hunter_badge", columnNames = {"hunter_id", "badge_key"}))
public class BadgeGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "grant_id")
    private Long grantId;

    @Column(name = "hunter_id", nullable = false, length = 100)
    private String hunterId;

    @Column(name = "badge_key", nullable = false, length = 50)
    private String badgeKey;

    /**
     * 按时间戳重放时，首次满足条件的那条 award 的时间
     */
    @Column(name = "qualifying_time", nullable = false)
    private LocalDateTime qualifyingTime;

    /**
     * 授予动作实际发生的时间（追溯授予时即重算时间）
     */
    @Column(name = "granted_time", nullable = false)
    private LocalDateTime grantedTime;

    /**
     * 是否由重算 / 回填的补发流程授予
     */
    @Column(name = "retroactive", nullable = false)
    private boolean retroactive;
}
