package com.bountyboard.progression.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 账本运行所需的基础 Bean：时钟、徽章发布线程池、异步与重试开关。
 */
@Configuration
@EnableAsync
@EnableRetry
@EnableConfigurationProperties(ProgressionProperties.class)
public class ProgressionConfig {

    /**
     * 所有时间戳统一使用 UTC
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 徽章文档发布线程池，与账本写入路径隔离：
     * 外部目标再慢也不会阻塞 award 写入。队列满时由调用线程执行，避免丢失发布。
     */
    @Bean
    public TaskExecutor badgePublishExecutor(ProgressionProperties properties) {
        ProgressionProperties.Publish publish = properties.getPublish();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(publish.getExecutorCoreSize());
        executor.setMaxPoolSize(publish.getExecutorMaxSize());
        executor.setQueueCapacity(publish.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("badge-publish-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
