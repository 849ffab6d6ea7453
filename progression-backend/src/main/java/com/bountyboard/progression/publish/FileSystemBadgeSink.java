package com.bountyboard.progression.publish;

import com.bountyboard.progression.config.ProgressionProperties;
import com.bountyboard.progression.exception.ErrorKind;
import com.bountyboard.progression.exception.PublishFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 把徽章文档写到目录，供静态托管的 shields endpoint 读取：
 * <pre>
 *   {outDir}/{metric}.json                  看板文档
 *   {outDir}/hunters/{slug}.json            XP 徽章
 *   {outDir}/hunters/{slug}-{metric}.json   其他指标
 * </pre>
 * 先写临时文件再原子替换，读取方不会读到写了一半的文件。
 * 同一 slug 的写出串行执行，并记录已写出的快照版本：重试中的旧快照不会覆盖新快照。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "progression.publish", name = "file-sink-enabled", havingValue = "true")
public class FileSystemBadgeSink implements BadgeDocumentSink {

    private final Path outDir;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, Long> writtenVersions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> slugLocks = new ConcurrentHashMap<>();

    public FileSystemBadgeSink(ProgressionProperties properties, ObjectMapper objectMapper) {
        this.outDir = Paths.get(properties.getPublish().getOutDir());
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        log.info("Badge file sink enabled, output directory: {}", outDir.toAbsolutePath());
    }

    @Override
    @Retryable(retryFor = PublishFailureException.class, maxAttempts = 4,
            backoff = @Backoff(delayExpression = "${progression.publish.retry-delay-ms:500}", multiplier = 2),
            recover = "recoverHunter")
    public void writeHunter(String slug, long version, SortedMap<String, BadgeDocument> documents) {
        Path dir = outDir.resolve("hunters");
        synchronized (slugLocks.computeIfAbsent(slug, k -> new Object())) {
            Long written = writtenVersions.get(slug);
            if (written != null && written > version) {
                log.debug("猎人 {} 已写出 v{}，跳过旧快照 v{}", slug, written, version);
                return;
            }
            for (Map.Entry<String, BadgeDocument> e : documents.entrySet()) {
                String fileName = BadgeDocumentFactory.XP_METRIC.equals(e.getKey())
                        ? slug + ".json"
                        : slug + "-" + e.getKey() + ".json";
                writeAtomically(dir.resolve(fileName), e.getValue());
            }
            writtenVersions.put(slug, version);
        }
        log.debug("已写出猎人 {} 的 {} 个徽章文档 (v{})", slug, documents.size(), version);
    }

    @Override
    @Retryable(retryFor = PublishFailureException.class, maxAttempts = 4,
            backoff = @Backoff(delayExpression = "${progression.publish.retry-delay-ms:500}", multiplier = 2),
            recover = "recoverBoard")
    public void writeBoard(SortedMap<String, BadgeDocument> documents) {
        for (Map.Entry<String, BadgeDocument> e : documents.entrySet()) {
            writeAtomically(outDir.resolve(e.getKey() + ".json"), e.getValue());
        }
    }

    @Recover
    public void recoverHunter(PublishFailureException e, String slug, long version,
                              SortedMap<String, BadgeDocument> documents) {
        log.error("[{}] 猎人 {} 的徽章文档 v{} 多次重试后仍写出失败，保留上一版文件: {}",
                ErrorKind.PUBLISH_FAILURE, slug, version, e.getMessage(), e);
    }

    @Recover
    public void recoverBoard(PublishFailureException e, SortedMap<String, BadgeDocument> documents) {
        log.error("[{}] 看板徽章文档多次重试后仍写出失败: {}", ErrorKind.PUBLISH_FAILURE, e.getMessage(), e);
    }

    private void writeAtomically(Path target, BadgeDocument document) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            String json = objectMapper.writeValueAsString(document) + "\n";
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PublishFailureException("Failed to write badge document " + target, e);
        }
    }
}
