package com.bountyboard.progression.publish;

import com.bountyboard.progression.dto.BoardSummaryDTO;
import com.bountyboard.progression.service.LeaderboardService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.SortedMap;

/**
 * 徽章文档发布。在账本事务提交后、锁外异步执行，失败不会回滚账本。
 */
@Slf4j
@Service
public class BadgePublishService {

    private final BadgeDocumentFactory documentFactory;
    private final BadgeDocumentStore documentStore;
    private final ObjectProvider<BadgeDocumentSink> sinks;
    private final LeaderboardService leaderboardService;

    public BadgePublishService(BadgeDocumentFactory documentFactory,
                               BadgeDocumentStore documentStore,
                               ObjectProvider<BadgeDocumentSink> sinks,
                               LeaderboardService leaderboardService) {
        this.documentFactory = documentFactory;
        this.documentStore = documentStore;
        this.sinks = sinks;
        this.leaderboardService = leaderboardService;
    }

    @Async("badgePublishExecutor")
    public void publishHunter(HunterDocumentSource source) {
        publishHunterNow(source);
    }

    @Async("badgePublishExecutor")
    public void publishBoard() {
        publishBoardNow();
    }

    /**
     * 同步发布一个猎人的全部文档（重发布和测试使用）
     */
    public void publishHunterNow(HunterDocumentSource source) {
        SortedMap<String, BadgeDocument> docs = documentFactory.hunterDocuments(source);
        if (!documentStore.putHunter(source.getSlug(), source.getVersion(), docs)) {
            log.debug("猎人 {} 的快照 v{} 已过期，跳过发布", source.getSlug(), source.getVersion());
            return;
        }
        sinks.orderedStream().forEach(sink -> sink.writeHunter(source.getSlug(), source.getVersion(), docs));
    }

    public void publishBoardNow() {
        BoardSummaryDTO summary = leaderboardService.getSummary();
        SortedMap<String, BadgeDocument> docs = documentFactory.boardDocuments(summary);
        documentStore.putBoard(docs);
        sinks.orderedStream().forEach(sink -> sink.writeBoard(docs));
        log.debug("看板文档已刷新: totalXp={}, hunters={}", summary.getTotalXp(), summary.getActiveHunters());
    }

    /**
     * 周增长随时间变化，即使没有新 award 也要定期刷新
     */
    @Scheduled(fixedDelayString = "${progression.publish.board-refresh-ms:60000}",
            initialDelayString = "${progression.publish.board-refresh-ms:60000}")
    public void refreshBoard() {
        publishBoardNow();
    }
}
