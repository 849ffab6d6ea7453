package com.bountyboard.progression.publish;

import java.util.SortedMap;

/**
 * 徽章文档的外部输出目标（文件目录、对象存储等）。
 * 失败时抛出 PublishFailureException，由实现自行重试。
 */
public interface BadgeDocumentSink {

    /**
     * @param version 快照版本（award 数）；实现必须保证旧版本不会覆盖已写出的新版本
     */
    void writeHunter(String slug, long version, SortedMap<String, BadgeDocument> documents);

    void writeBoard(SortedMap<String, BadgeDocument> documents);
}
