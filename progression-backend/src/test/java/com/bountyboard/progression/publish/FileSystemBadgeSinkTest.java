package com.bountyboard.progression.publish;

import com.bountyboard.progression.config.ProgressionProperties;
import com.bountyboard.progression.exception.PublishFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemBadgeSinkTest {

    @TempDir
    Path tempDir;

    private FileSystemBadgeSink sinkAt(Path dir) {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getPublish().setOutDir(dir.toString());
        return new FileSystemBadgeSink(properties, new ObjectMapper());
    }

    @Test
    void testWriteHunterLayout() throws Exception {
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("xp", BadgeDocument.of("alice XP", "220 (L2 Basic Hunter)", "blue", "github", "white"));
        docs.put("badge-first-blood", BadgeDocument.of("First Blood", "earned", "red", "git", "white"));

        sinkAt(tempDir).writeHunter("alice", 3, docs);

        Path xp = tempDir.resolve("hunters/alice.json");
        assertThat(xp).exists();
        assertThat(tempDir.resolve("hunters/alice-badge-first-blood.json")).exists();
        assertThat(Files.readString(xp))
                .contains("\"schemaVersion\" : 1")
                .contains("\"message\" : \"220 (L2 Basic Hunter)\"")
                .endsWith("\n");
        // 不残留临时文件
        try (Stream<Path> files = Files.list(tempDir.resolve("hunters"))) {
            assertThat(files).noneMatch(p -> p.toString().endsWith(".tmp"));
        }
    }

    @Test
    void testOlderSnapshotDoesNotOverwriteNewerFiles() throws Exception {
        FileSystemBadgeSink sink = sinkAt(tempDir);
        SortedMap<String, BadgeDocument> v5 = new TreeMap<>();
        v5.put("xp", BadgeDocument.of("alice XP", "520 (L3 Priority Hunter)", "blue", "github", "white"));
        SortedMap<String, BadgeDocument> v4 = new TreeMap<>();
        v4.put("xp", BadgeDocument.of("alice XP", "420 (L2 Basic Hunter)", "blue", "github", "white"));

        sink.writeHunter("alice", 5, v5);
        sink.writeHunter("alice", 4, v4);

        assertThat(Files.readString(tempDir.resolve("hunters/alice.json"))).contains("520 (L3 Priority Hunter)");

        // 同一版本可以重写（重发布）
        SortedMap<String, BadgeDocument> again = new TreeMap<>();
        again.put("xp", BadgeDocument.of("Alice XP", "520 (L3 Priority Hunter)", "blue", "github", "white"));
        sink.writeHunter("alice", 5, again);
        assertThat(Files.readString(tempDir.resolve("hunters/alice.json"))).contains("Alice XP");
    }

    @Test
    void testFailedWriteDoesNotBlockSameVersionRetry() throws Exception {
        Path out = tempDir.resolve("out");
        Files.writeString(out, "blocked");
        FileSystemBadgeSink sink = sinkAt(out);
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("xp", BadgeDocument.of("bob XP", "20 (L1 Starting Hunter)", "blue", "github", "white"));

        assertThatThrownBy(() -> sink.writeHunter("bob", 2, docs)).isInstanceOf(PublishFailureException.class);

        Files.delete(out);
        sink.writeHunter("bob", 2, docs);
        assertThat(out.resolve("hunters/bob.json")).exists();
    }

    @Test
    void testWriteBoardOverwrites() throws Exception {
        FileSystemBadgeSink sink = sinkAt(tempDir);
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("hunter-stats", BadgeDocument.of("Hunter Stats", "100 total", "orange", "rust", "white"));
        sink.writeBoard(docs);
        docs.put("hunter-stats", BadgeDocument.of("Hunter Stats", "320 total", "orange", "rust", "white"));
        sink.writeBoard(docs);

        assertThat(Files.readString(tempDir.resolve("hunter-stats.json"))).contains("320 total");
    }

    @Test
    void testUnwritableDirectory() throws Exception {
        Path blocked = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("xp", BadgeDocument.of("bob XP", "20 (L1 Starting Hunter)", "blue", "github", "white"));

        assertThatThrownBy(() -> sinkAt(blocked).writeHunter("bob", 1, docs))
                .isInstanceOf(PublishFailureException.class);
    }
}
