package com.ivamare.exchange.model;

import com.ivamare.exchange.output.OutputHandler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one business-logic invocation.
 *
 * <p>Created through {@link #createSuccess}, {@link #createFailure} or
 * {@link #createSkipped}. The success flag always agrees with the status:
 * it is false exactly for failed, error and dead-lettered results.
 */
public class ProcessingResult {

    private ProcessingStatus status;
    private boolean success;
    private final List<Message> outputMessages = new ArrayList<>();
    private final List<OutputHandler> outputHandlers = new ArrayList<>();
    private final List<String> entitiesCreated = new ArrayList<>();
    private final List<String> entitiesUpdated = new ArrayList<>();
    private String errorMessage;
    private String errorCode;
    private final Map<String, Object> errorDetails = new HashMap<>();
    private boolean canRetry;
    private Integer retryAfterSeconds;
    private long processingDurationMs;
    private Instant completedAt;
    private ProcessorInfo processorInfo;
    private final Map<String, Object> processingMetadata = new LinkedHashMap<>();

    private ProcessingResult(ProcessingStatus status, boolean success) {
        this.status = status;
        this.success = success;
        this.completedAt = Instant.now();
    }

    public static ProcessingResult createSuccess() {
        return new ProcessingResult(ProcessingStatus.SUCCESS, true);
    }

    public static ProcessingResult createSuccess(List<String> entitiesCreated, List<String> entitiesUpdated) {
        ProcessingResult result = createSuccess();
        if (entitiesCreated != null) {
            result.entitiesCreated.addAll(entitiesCreated);
        }
        if (entitiesUpdated != null) {
            result.entitiesUpdated.addAll(entitiesUpdated);
        }
        return result;
    }

    public static ProcessingResult createFailure(String errorMessage, String errorCode, boolean canRetry) {
        return createFailure(errorMessage, errorCode, canRetry, null, Map.of());
    }

    /**
     * Failed result. Retryable failures get status {@code error}, others {@code failed}.
     */
    public static ProcessingResult createFailure(String errorMessage, String errorCode, boolean canRetry,
                                                 Integer retryAfterSeconds, Map<String, Object> errorDetails) {
        ProcessingResult result = new ProcessingResult(
            canRetry ? ProcessingStatus.ERROR : ProcessingStatus.FAILED, false);
        result.errorMessage = errorMessage;
        result.errorCode = errorCode;
        result.canRetry = canRetry;
        result.retryAfterSeconds = retryAfterSeconds;
        if (errorDetails != null) {
            result.errorDetails.putAll(errorDetails);
        }
        return result;
    }

    public static ProcessingResult createSkipped(String reason) {
        ProcessingResult result = new ProcessingResult(ProcessingStatus.SKIPPED, true);
        result.processingMetadata.put("skip_reason", reason);
        return result;
    }

    // --- Mutators used by processors ---

    public ProcessingResult addMetadata(String key, Object value) {
        processingMetadata.put(key, value);
        return this;
    }

    public ProcessingResult addOutputHandler(OutputHandler handler) {
        outputHandlers.add(handler);
        return this;
    }

    public ProcessingResult addOutputMessage(Message message) {
        outputMessages.add(message);
        return this;
    }

    public ProcessingResult addEntityCreated(String entityId) {
        entitiesCreated.add(entityId);
        return this;
    }

    public ProcessingResult addEntityUpdated(String entityId) {
        entitiesUpdated.add(entityId);
        return this;
    }

    // --- Transitions used by the processor handler ---

    /**
     * Record that the failure was forwarded to the dead-letter destination.
     */
    public void markDeadLettered() {
        if (success) {
            throw new IllegalStateException("Only failed results can be dead-lettered");
        }
        status = ProcessingStatus.DEAD_LETTERED;
    }

    /**
     * Turn a successful result into a failure because required outputs were not
     * delivered. The status becomes error when retryable, failed otherwise.
     */
    public void markDeliveryFailure(String errorMessage, String errorCode, boolean canRetry,
                                    Integer retryAfterSeconds) {
        this.status = canRetry ? ProcessingStatus.ERROR : ProcessingStatus.FAILED;
        this.success = false;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
        this.canRetry = canRetry;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public void setProcessingDurationMs(long processingDurationMs) {
        this.processingDurationMs = processingDurationMs;
    }

    public void setProcessorInfo(ProcessorInfo processorInfo) {
        this.processorInfo = processorInfo;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    /**
     * Compact view for logging and monitoring.
     */
    public Map<String, Object> getSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.getValue());
        summary.put("success", success);
        summary.put("entities_created", entitiesCreated.size());
        summary.put("entities_updated", entitiesUpdated.size());
        summary.put("output_messages", outputMessages.size());
        summary.put("output_handlers", outputHandlers.size());
        summary.put("processing_duration_ms", processingDurationMs);
        if (!success) {
            summary.put("error_code", errorCode);
            summary.put("error_message", errorMessage);
            summary.put("can_retry", canRetry);
        }
        return summary;
    }

    public ProcessingStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<Message> getOutputMessages() {
        return Collections.unmodifiableList(outputMessages);
    }

    public List<OutputHandler> getOutputHandlers() {
        return Collections.unmodifiableList(outputHandlers);
    }

    public List<String> getEntitiesCreated() {
        return Collections.unmodifiableList(entitiesCreated);
    }

    public List<String> getEntitiesUpdated() {
        return Collections.unmodifiableList(entitiesUpdated);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getErrorDetails() {
        return Collections.unmodifiableMap(errorDetails);
    }

    public boolean isCanRetry() {
        return canRetry;
    }

    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public long getProcessingDurationMs() {
        return processingDurationMs;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public ProcessorInfo getProcessorInfo() {
        return processorInfo;
    }

    public Map<String, Object> getProcessingMetadata() {
        return Collections.unmodifiableMap(processingMetadata);
    }

    @Override
    public String toString() {
        return "ProcessingResult" + getSummary();
    }
}
