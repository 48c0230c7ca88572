package com.ivamare.exchange.output;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.exception.OutputDeliveryException;
import com.ivamare.exchange.model.EntityReference;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.policy.BackoffPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes results to files below a base directory.
 *
 * <p>The destination is the base directory. File names come from
 * {@code file_pattern}, which may contain the placeholders
 * {@code {message_id}}, {@code {correlation_id}}, {@code {timestamp}},
 * {@code {date}}, {@code {time}}, {@code {external_id}},
 * {@code {canonical_type}} and {@code {tenant_id}}.
 */
public class FileOutputHandler extends AbstractOutputHandler {

    private static final Logger log = LoggerFactory.getLogger(FileOutputHandler.class);

    public static final String DEFAULT_FILE_PATTERN = "{message_id}.json";
    static final int WRITE_FAILURE_BASE_DELAY = 1;

    private static final Set<String> FORMATS = Set.of("json", "jsonl");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH-mm-ss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileOutputHandler(String destination, Map<String, Object> config,
                             ObjectMapper objectMapper, BackoffPolicy backoffPolicy) {
        this(destination, config, objectMapper, backoffPolicy, Clock.systemUTC());
    }

    public FileOutputHandler(String destination, Map<String, Object> config,
                             ObjectMapper objectMapper, BackoffPolicy backoffPolicy, Clock clock) {
        super(destination, config, backoffPolicy);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean validateConfiguration() {
        if (getDestination() == null || getDestination().isBlank()) {
            log.error("No base directory provided for FileOutputHandler");
            return false;
        }
        if (!FORMATS.contains(outputFormat())) {
            log.error("Unsupported output format: {}", outputFormat());
            return false;
        }
        String pattern = filePattern();
        if (pattern.isBlank() || pattern.startsWith("/") || pattern.contains("..")) {
            log.error("File pattern must be a relative path inside the base directory: {}", pattern);
            return false;
        }
        return true;
    }

    @Override
    protected Map<String, Object> deliver(Message message, ProcessingResult result) {
        Path baseDirectory = Paths.get(getDestination()).toAbsolutePath().normalize();
        String relativePath = resolvePattern(message);
        Path filePath = baseDirectory.resolve(relativePath).normalize();
        if (!filePath.startsWith(baseDirectory) || filePath.equals(baseDirectory)) {
            Map<String, Object> details = new HashMap<>();
            details.put("file_pattern", filePattern());
            details.put("resolved_path", relativePath);
            throw new OutputDeliveryException(
                "Resolved file path leaves the base directory: " + relativePath,
                ErrorCodes.INVALID_FILE_PATTERN, false, null, details, null);
        }
        String content = formatContent(message, result, filePath);

        ensureDirectory(filePath.getParent());

        try {
            if (appendMode()) {
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            }
        } catch (AccessDeniedException e) {
            throw new OutputDeliveryException(
                "Permission denied writing " + filePath,
                ErrorCodes.FILE_PERMISSION_DENIED, false, null, Map.of("file_path", filePath.toString()), e);
        } catch (IOException e) {
            Map<String, Object> details = new HashMap<>();
            details.put("file_path", filePath.toString());
            details.put("exception_type", e.getClass().getName());
            throw new OutputDeliveryException(
                "Failed to write " + filePath + ": " + e.getMessage(),
                ErrorCodes.FILE_WRITE_FAILED, true, WRITE_FAILURE_BASE_DELAY, details, e);
        }

        log.info("Message {} written to {}", message.getMessageId(), filePath);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_path", filePath.toString());
        metadata.put("bytes_written", content.getBytes(StandardCharsets.UTF_8).length);
        metadata.put("output_format", outputFormat());
        metadata.put("append_mode", appendMode());
        return metadata;
    }

    String resolvePattern(Message message) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        EntityReference reference = message.getEntityReference();

        Map<String, String> vars = new HashMap<>();
        vars.put("message_id", message.getMessageId());
        vars.put("correlation_id", String.valueOf(message.getCorrelationId()));
        vars.put("timestamp", now.toInstant().toString().replace(':', '-'));
        vars.put("date", now.format(DATE));
        vars.put("time", now.format(TIME));
        vars.put("external_id", reference != null ? String.valueOf(reference.externalId()) : "unknown");
        vars.put("canonical_type", reference != null ? String.valueOf(reference.canonicalType()) : "unknown");
        vars.put("tenant_id", reference != null ? String.valueOf(reference.tenantId()) : "unknown");

        Matcher matcher = PLACEHOLDER.matcher(filePattern());
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String value = vars.get(matcher.group(1));
            if (value == null) {
                Map<String, Object> details = new HashMap<>();
                details.put("file_pattern", filePattern());
                details.put("placeholder", matcher.group(1));
                throw new OutputDeliveryException(
                    "Invalid variable in file_pattern: " + matcher.group(1),
                    ErrorCodes.INVALID_FILE_PATTERN, false, null, details, null);
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    private String formatContent(Message message, ProcessingResult result, Path filePath) {
        Map<String, Object> routing = new LinkedHashMap<>();
        routing.put("source_handler", getHandlerName());
        routing.put("target_path", filePath.toString());
        routing.put("destination_type", "file");
        Map<String, Object> envelope = OutputEnvelope.build(message, result, routing);

        try {
            if ("jsonl".equals(outputFormat())) {
                return objectMapper.writeValueAsString(envelope) + "\n";
            }
            String json = prettyPrint()
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope)
                : objectMapper.writeValueAsString(envelope);
            return json + "\n";
        } catch (JsonProcessingException e) {
            throw new OutputDeliveryException(
                "Failed to serialize message for file output",
                ErrorCodes.MESSAGE_SERIALIZATION_FAILED, false, null,
                Map.of("message_id", message.getMessageId()), e);
        }
    }

    private void ensureDirectory(Path directory) {
        if (directory == null || Files.isDirectory(directory)) {
            return;
        }
        if (!createDirectories()) {
            throw new OutputDeliveryException(
                "Directory " + directory + " does not exist and create_directories is disabled",
                ErrorCodes.DIRECTORY_NOT_FOUND, false, null, Map.of("directory", directory.toString()), null);
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new OutputDeliveryException(
                "Failed to create directory " + directory + ": " + e.getMessage(),
                ErrorCodes.FILE_WRITE_FAILED, true, WRITE_FAILURE_BASE_DELAY,
                Map.of("directory", directory.toString()), e);
        }
    }

    @Override
    public Map<String, Object> getHandlerInfo() {
        Map<String, Object> info = super.getHandlerInfo();
        info.put("handler_type", "file");
        info.put("output_format", outputFormat());
        info.put("file_pattern", filePattern());
        info.put("append_mode", appendMode());
        return info;
    }

    String outputFormat() {
        return configString("output_format", "json");
    }

    String filePattern() {
        return configString("file_pattern", DEFAULT_FILE_PATTERN);
    }

    boolean appendMode() {
        return configBoolean("append_mode", true);
    }

    boolean createDirectories() {
        return configBoolean("create_directories", true);
    }

    boolean prettyPrint() {
        return configBoolean("pretty_print", true);
    }
}
