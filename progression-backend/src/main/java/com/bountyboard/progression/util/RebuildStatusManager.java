package com.bountyboard.progression.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 重建状态管理器：回填或全量重算进行中时置位，
 * 查询接口据此直接返回 423，而不是长时间阻塞在账本读锁上。
 * 回填和重算可能先后排队，按进入次数计数，全部结束后才清除。
 */
@Component
public class RebuildStatusManager {

    private static final Logger log = LoggerFactory.getLogger(RebuildStatusManager.class);

    private final AtomicInteger depth = new AtomicInteger();

    /**
     * 开始一次重建，必须与 {@link #exitRebuild()} 成对调用（finally 中）
     */
    public void enterRebuild() {
        int current = depth.incrementAndGet();
        log.info("账本重建开始 (进行中: {})", current);
    }

    public void exitRebuild() {
        int current = depth.updateAndGet(d -> Math.max(d - 1, 0));
        log.info("账本重建结束 (剩余: {})", current);
    }

    public boolean isRebuildInProgress() {
        return depth.get() > 0;
    }
}
