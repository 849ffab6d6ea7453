package com.bountyboard.progression.publish;

import com.bountyboard.progression.config.ProgressionProperties;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * 通过 Spring 代理调用文件输出，验证 @Retryable 重试和 @Recover 兜底
 */
@ExtendWith(OutputCaptureExtension.class)
@SpringJUnitConfig(FileSystemBadgeSinkRetryTest.RetryConfig.class)
@TestPropertySource(properties = "progression.publish.retry-delay-ms=10")
class FileSystemBadgeSinkRetryTest {

    @Autowired
    @Qualifier("blockedSink")
    private BadgeDocumentSink blockedSink;

    @Autowired
    @Qualifier("flakySink")
    private BadgeDocumentSink flakySink;

    @Autowired
    @Qualifier("flakyMapper")
    private ObjectMapper flakyMapper;

    @Autowired
    @Qualifier("flakyDir")
    private Path flakyDir;

    private static SortedMap<String, BadgeDocument> xpDocs(String handle) {
        SortedMap<String, BadgeDocument> docs = new TreeMap<>();
        docs.put("xp", BadgeDocument.of(handle + " XP", "20 (L1 Starting Hunter)", "blue", "github", "white"));
        return docs;
    }

    @Test
    void testTransientFailureIsRetried() throws Exception {
        flakySink.writeHunter("carol", 1, xpDocs("carol"));

        // 第一次序列化失败，第二次成功
        verify(flakyMapper, times(2)).writeValueAsString(any());
        assertThat(Files.readString(flakyDir.resolve("hunters/carol.json"))).isEqualTo("{\"ok\":true}\n");
    }

    @Test
    void testExhaustedRetriesAreRecovered(CapturedOutput output) {
        assertThatCode(() -> blockedSink.writeHunter("bob", 1, xpDocs("bob"))).doesNotThrowAnyException();
        assertThatCode(() -> blockedSink.writeBoard(xpDocs("board"))).doesNotThrowAnyException();

        assertThat(output.getOut()).contains("PUBLISH_FAILURE").contains("bob");
    }

    @Configuration
    @EnableRetry
    static class RetryConfig {

        @Bean
        Path blockedPath() throws IOException {
            // 输出目录是一个普通文件，任何写出都会失败
            return Files.createTempFile("badge-sink", ".blocked");
        }

        @Bean
        Path flakyDir() throws IOException {
            return Files.createTempDirectory("badge-sink");
        }

        @Bean
        ObjectMapper flakyMapper() throws Exception {
            ObjectMapper mapper = mock(ObjectMapper.class);
            when(mapper.enable(SerializationFeature.INDENT_OUTPUT)).thenReturn(mapper);
            when(mapper.writeValueAsString(any()))
                    .thenThrow(new JsonMappingException((Closeable) null, "disk hiccup"))
                    .thenReturn("{\"ok\":true}");
            return mapper;
        }

        @Bean
        BadgeDocumentSink blockedSink(@Qualifier("blockedPath") Path blockedPath) {
            return new FileSystemBadgeSink(properties(blockedPath), new ObjectMapper());
        }

        @Bean
        BadgeDocumentSink flakySink(@Qualifier("flakyDir") Path flakyDir,
                                    @Qualifier("flakyMapper") ObjectMapper flakyMapper) {
            ObjectMapper source = mock(ObjectMapper.class);
            when(source.copy()).thenReturn(flakyMapper);
            return new FileSystemBadgeSink(properties(flakyDir), source);
        }

        private static ProgressionProperties properties(Path outDir) {
            ProgressionProperties properties = new ProgressionProperties();
            properties.getPublish().setOutDir(outDir.toString());
            return properties;
        }
    }
}
