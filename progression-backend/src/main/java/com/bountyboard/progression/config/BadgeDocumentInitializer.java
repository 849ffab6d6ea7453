package com.bountyboard.progression.config;

import com.bountyboard.progression.service.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 徽章文档初始化器。
 * 文档查询表只在内存中，重启后为空；应用就绪时按账本重新生成全部猎人和看板文档，
 * 之后才能通过 /api/badges 查到。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BadgeDocumentInitializer {

    private final LedgerService ledgerService;
    private final ProgressionProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void republishOnStartup() {
        if (!properties.getPublish().isRepublishOnStartup()) {
            log.info("[文档初始化] 已关闭启动重发布");
            return;
        }
        try {
            int hunters = ledgerService.republishAll();
            log.info("[文档初始化] 已从账本重新生成 {} 个猎人的徽章文档", hunters);
        } catch (RuntimeException e) {
            // 账本本身不受影响，可稍后调用 POST /api/badges/republish 重试
            log.error("[文档初始化] 启动重发布失败: {}", e.getMessage(), e);
        }
    }
}
