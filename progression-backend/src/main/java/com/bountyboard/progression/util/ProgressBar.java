package com.bountyboard.progression.util;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 通用进度条工具类
 * 用于回填、全量重算等长时间运行的任务
 */
public class ProgressBar {
    private final String taskName;
    private final int totalSteps;
    private int currentStep;
    private final LocalDateTime startTime;
    private final int updateInterval;
    private int lastReportedPercentage = -1;

    /**
     * @param taskName 任务名称
     * @param totalSteps 总步骤数
     */
    public ProgressBar(String taskName, int totalSteps) {
        this(taskName, totalSteps, 10); // 默认每10%更新一次
    }

    /**
     * @param taskName 任务名称
     * @param totalSteps 总步骤数
     * @param updateInterval 更新间隔（百分比）
     */
    public ProgressBar(String taskName, int totalSteps, int updateInterval) {
        this.taskName = taskName;
        this.totalSteps = totalSteps > 0 ? totalSteps : 1;
        this.currentStep = 0;
        this.startTime = LocalDateTime.now();
        this.updateInterval = updateInterval > 0 ? updateInterval : 10;
        System.out.printf("[%s] 开始任务，共 %d 步%n", taskName, totalSteps);
    }

    public void step() {
        currentStep++;
        displayProgress();
    }

    public int getCurrentStep() {
        return currentStep;
    }

    /**
     * 完成任务
     */
    public void complete() {
        currentStep = totalSteps;
        System.out.printf("\r[%s] 进度: %d/%d (100%%)%n", taskName, currentStep, totalSteps);
        long duration = ChronoUnit.MILLIS.between(startTime, LocalDateTime.now());
        System.out.printf("[%s] 任务完成！总耗时: %dms%n", taskName, duration);
    }

    private void displayProgress() {
        int percentage = Math.min(100, (int) ((currentStep * 100.0) / totalSteps));
        // 只有当百分比变化且达到更新间隔时才显示
        if (percentage != lastReportedPercentage && (percentage % updateInterval == 0 || percentage == 100)) {
            System.out.printf("\r[%s] 进度: %d/%d (%d%%) | 预计剩余: %s",
                    taskName, currentStep, totalSteps, percentage, estimateRemaining(percentage));
            lastReportedPercentage = percentage;
        }
    }

    private String estimateRemaining(int percentage) {
        if (percentage == 0) {
            return "计算中...";
        }
        long elapsedMs = ChronoUnit.MILLIS.between(startTime, LocalDateTime.now());
        long remainingMs = (elapsedMs * 100) / percentage - elapsedMs;
        if (remainingMs < 1000) {
            return "<1s";
        } else if (remainingMs < 60000) {
            return (remainingMs / 1000) + "s";
        }
        return (remainingMs / 60000) + "m " + ((remainingMs % 60000) / 1000) + "s";
    }
}
