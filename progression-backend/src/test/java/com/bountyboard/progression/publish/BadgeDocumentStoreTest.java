package com.bountyboard.progression.publish;

import org.junit.jupiter.api.Test;

import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class BadgeDocumentStoreTest {

    private final BadgeDocumentStore store = new BadgeDocumentStore();

    private static SortedMap<String, BadgeDocument> docs(String message) {
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("xp", BadgeDocument.of("alice XP", message, "blue", "github", "white"));
        return docs;
    }

    @Test
    void testOlderSnapshotDoesNotOverwriteNewer() {
        assertTrue(store.putHunter("alice", 3, docs("220 (L2 Basic Hunter)")));
        assertFalse(store.putHunter("alice", 2, docs("120 (L1 Starting Hunter)")));

        assertEquals("220 (L2 Basic Hunter)", store.findHunterDocument("alice", "xp").orElseThrow().getMessage());
    }

    @Test
    void testSameVersionReplaces() {
        store.putHunter("alice", 3, docs("old"));
        assertTrue(store.putHunter("alice", 3, docs("new")));

        assertEquals("new", store.findHunterDocument("alice", "xp").orElseThrow().getMessage());
    }

    @Test
    void testStoredSnapshotIsIsolatedFromCaller() {
        SortedMap<String, BadgeDocument> docs = docs("220");
        store.putHunter("alice", 1, docs);
        docs.put("rtc", BadgeDocument.of("RTC Earned", "5 RTC", "orange", "bitcoin", "white"));

        assertTrue(store.findHunterDocument("alice", "rtc").isEmpty());
        assertTrue(store.findHunterDocument("nobody", "xp").isEmpty());
    }
}
