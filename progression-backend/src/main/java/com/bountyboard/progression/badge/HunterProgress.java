package com.bountyboard.progression.badge;

import com.bountyboard.progression.entity.ActionKind;
import com.bountyboard.progression.entity.Award;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 徽章谓词看到的猎人状态：累计 XP、按时间排序的 award、各动作计数。
 * 由评估器按时间戳顺序逐条追加构建，规则只读。
 */
public final class HunterProgress {

    private final String hunterId;
    private final String handle;
    private final List<Award> awards = new ArrayList<>();
    private final Map<ActionKind, Integer> actionCounts = new EnumMap<>(ActionKind.class);
    private long cumulativeXp;

    public HunterProgress(String hunterId, String handle) {
        this.hunterId = hunterId;
        this.handle = handle;
    }

    /**
     * 追加一条 award。调用方须按时间戳顺序追加
     */
    public void append(Award award) {
        awards.add(award);
        actionCounts.merge(award.getActionKind(), 1, Integer::sum);
        cumulativeXp += award.getXpAmount();
    }

    public String getHunterId() {
        return hunterId;
    }

    public String getHandle() {
        return handle;
    }

    public long getCumulativeXp() {
        return cumulativeXp;
    }

    /**
     * 已按 occurredTime（同时刻按到达顺序）排序
     */
    public List<Award> getAwards() {
        return Collections.unmodifiableList(awards);
    }

    public int count(ActionKind kind) {
        return actionCounts.getOrDefault(kind, 0);
    }
}
