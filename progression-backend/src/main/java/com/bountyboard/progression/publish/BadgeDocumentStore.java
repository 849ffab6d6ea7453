package com.bountyboard.progression.publish;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已发布徽章文档的内存查询表。
 * 每个猎人的全部文档作为一个不可变整体替换，读者不会看到新旧混合的结果。
 */
@Component
public class BadgeDocumentStore {

    private final ConcurrentHashMap<String, Snapshot> hunters = new ConcurrentHashMap<>();
    private volatile Map<String, BadgeDocument> board = Collections.emptyMap();

    /**
     * 替换某个猎人的文档；比已有快照旧的版本被丢弃
     *
     * @return 是否真正替换
     */
    public boolean putHunter(String slug, long version, SortedMap<String, BadgeDocument> documents) {
        Snapshot candidate = new Snapshot(version, Collections.unmodifiableSortedMap(new TreeMap<>(documents)));
        Snapshot result = hunters.merge(slug, candidate,
                (current, next) -> next.version() >= current.version() ? next : current);
        return result == candidate;
    }

    public void putBoard(SortedMap<String, BadgeDocument> documents) {
        board = Collections.unmodifiableSortedMap(new TreeMap<>(documents));
    }

    public Optional<BadgeDocument> findHunterDocument(String slug, String metric) {
        Snapshot snapshot = hunters.get(slug);
        return snapshot == null ? Optional.empty() : Optional.ofNullable(snapshot.documents().get(metric));
    }

    public Map<String, BadgeDocument> hunterDocuments(String slug) {
        Snapshot snapshot = hunters.get(slug);
        return snapshot == null ? Collections.emptyMap() : snapshot.documents();
    }

    public Optional<BadgeDocument> findBoardDocument(String metric) {
        return Optional.ofNullable(board.get(metric));
    }

    private record Snapshot(long version, Map<String, BadgeDocument> documents) {
    }
}
