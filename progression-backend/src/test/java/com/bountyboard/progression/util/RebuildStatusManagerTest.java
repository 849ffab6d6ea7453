package com.bountyboard.progression.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RebuildStatusManagerTest {

    @Test
    void testOverlappingRebuilds() {
        RebuildStatusManager manager = new RebuildStatusManager();
        assertFalse(manager.isRebuildInProgress());

        manager.enterRebuild();   // 回填
        manager.enterRebuild();   // 全量重算
        manager.exitRebuild();
        // 先结束的一方不能清除另一方的状态
        assertTrue(manager.isRebuildInProgress());

        manager.exitRebuild();
        assertFalse(manager.isRebuildInProgress());
    }

    @Test
    void testUnbalancedExitDoesNotGoNegative() {
        RebuildStatusManager manager = new RebuildStatusManager();
        manager.exitRebuild();
        manager.enterRebuild();

        assertTrue(manager.isRebuildInProgress());
    }
}
