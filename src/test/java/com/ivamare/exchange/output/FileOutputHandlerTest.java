package com.ivamare.exchange.output;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.model.EntityReference;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.policy.BackoffPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileOutputHandler")
class FileOutputHandlerTest {

    @TempDir
    Path baseDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:20:30Z"), ZoneOffset.UTC);

    private final Message message = Message.builder()
        .messageId("msg-1")
        .correlationId("corr-1")
        .entityReference(EntityReference.of("ORD-1", "order", "erp", "acme"))
        .payload(Map.of("amount", 1500))
        .build();

    private FileOutputHandler handler(Map<String, Object> config) {
        return new FileOutputHandler(baseDir.toString(), config, objectMapper,
            new BackoffPolicy(1, 300, 2.0, false), clock);
    }

    @Test
    @DisplayName("should write envelope to default file name")
    void shouldWriteEnvelope() throws IOException {
        OutputHandlerResult handlerResult = handler(Map.of()).handle(message, ProcessingResult.createSuccess());

        Path written = baseDir.resolve("msg-1.json");
        assertTrue(handlerResult.success());
        assertTrue(Files.exists(written));
        assertEquals(written.toString(), handlerResult.metadata().get("file_path"));
        assertEquals("json", handlerResult.metadata().get("output_format"));
        assertEquals(true, handlerResult.metadata().get("append_mode"));

        JsonNode envelope = objectMapper.readTree(Files.readString(written));
        assertEquals("msg-1", envelope.at("/message_metadata/message_id").asText());
        assertEquals(written.toString(), envelope.at("/routing_metadata/target_path").asText());
        assertEquals("file", envelope.at("/routing_metadata/destination_type").asText());
    }

    @Test
    @DisplayName("should resolve placeholders and create directories")
    void shouldResolvePlaceholders() {
        FileOutputHandler handler = handler(Map.of(
            "file_pattern", "{tenant_id}/{canonical_type}/{date}/{external_id}-{time}.json"));

        OutputHandlerResult handlerResult = handler.handle(message, ProcessingResult.createSuccess());

        assertTrue(handlerResult.success());
        assertTrue(Files.exists(baseDir.resolve("acme/order/2024-03-15/ORD-1-10-20-30.json")));
    }

    @Test
    @DisplayName("should format timestamp without colons and fall back to unknown")
    void shouldFormatTimestamp() {
        FileOutputHandler handler = handler(Map.of("file_pattern", "{external_id}_{timestamp}.json"));

        String resolved = handler.resolvePattern(Message.builder().messageId("m").build());

        assertEquals("unknown_2024-03-15T10-20-30Z.json", resolved);
    }

    @Test
    @DisplayName("should append json lines")
    void shouldAppendJsonLines() throws IOException {
        FileOutputHandler handler = handler(Map.of("output_format", "jsonl", "file_pattern", "events.jsonl"));

        handler.handle(message, ProcessingResult.createSuccess());
        handler.handle(message, ProcessingResult.createSuccess());

        List<String> lines = Files.readAllLines(baseDir.resolve("events.jsonl"));
        assertEquals(2, lines.size());
        assertEquals("msg-1", objectMapper.readTree(lines.get(1)).at("/message_metadata/message_id").asText());
    }

    @Test
    @DisplayName("should overwrite when append mode is off")
    void shouldOverwriteWhenAppendModeOff() throws IOException {
        FileOutputHandler handler = handler(Map.of(
            "append_mode", false, "pretty_print", false, "file_pattern", "latest.json"));

        handler.handle(message, ProcessingResult.createSuccess());
        handler.handle(message, ProcessingResult.createSuccess());

        assertEquals(1, Files.readAllLines(baseDir.resolve("latest.json")).size());
    }

    @Test
    @DisplayName("should fail for unknown placeholder")
    void shouldFailForUnknownPlaceholder() {
        OutputHandlerResult handlerResult = handler(Map.of("file_pattern", "{customer}.json"))
            .handle(message, ProcessingResult.createSuccess());

        assertEquals(ErrorCodes.INVALID_FILE_PATTERN, handlerResult.errorCode());
        assertFalse(handlerResult.canRetry());
    }

    @Test
    @DisplayName("should refuse message values that leave the base directory")
    void shouldRefuseEscapingPath() throws IOException {
        Message hostile = Message.builder()
            .messageId("msg-2")
            .entityReference(EntityReference.of("../escaped", "order", "erp", "acme"))
            .build();

        OutputHandlerResult handlerResult = handler(Map.of("file_pattern", "{external_id}.json"))
            .handle(hostile, ProcessingResult.createSuccess());

        assertFalse(handlerResult.success());
        assertEquals(ErrorCodes.INVALID_FILE_PATTERN, handlerResult.errorCode());
        assertFalse(handlerResult.canRetry());
        assertFalse(Files.exists(baseDir.getParent().resolve("escaped.json")));
        try (var files = Files.list(baseDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("should fail when directory is missing and creation is disabled")
    void shouldFailWhenDirectoryMissing() {
        Map<String, Object> config = new HashMap<>();
        config.put("file_pattern", "missing/{message_id}.json");
        config.put("create_directories", false);

        OutputHandlerResult handlerResult = handler(config).handle(message, ProcessingResult.createSuccess());

        assertEquals(ErrorCodes.DIRECTORY_NOT_FOUND, handlerResult.errorCode());
        assertFalse(handlerResult.canRetry());
    }

    @Test
    @DisplayName("should report retryable write failure")
    void shouldReportWriteFailure() throws IOException {
        Files.createDirectory(baseDir.resolve("msg-1.json"));

        OutputHandlerResult handlerResult = handler(Map.of()).handle(message, ProcessingResult.createSuccess());

        assertEquals(ErrorCodes.FILE_WRITE_FAILED, handlerResult.errorCode());
        assertTrue(handlerResult.canRetry());
        assertEquals(1, handlerResult.retryAfterSeconds());
    }

    @Test
    @DisplayName("should reject invalid configuration")
    void shouldRejectInvalidConfiguration() {
        assertFalse(handler(Map.of("output_format", "xml")).validateConfiguration());
        assertFalse(handler(Map.of("file_pattern", "../escape.json")).validateConfiguration());
        assertFalse(handler(Map.of("file_pattern", "/etc/passwd")).validateConfiguration());
        assertFalse(new FileOutputHandler(" ", Map.of(), objectMapper, BackoffPolicy.defaultPolicy())
            .validateConfiguration());
        assertTrue(handler(Map.of()).validateConfiguration());
    }
}
