package com.ivamare.exchange.output;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable outcome of one output handler invocation.
 *
 * @param status Delivery status
 * @param success Whether the delivery counts as successful (true for skipped)
 * @param handlerName Name of the handler that produced this result
 * @param destination Logical destination of the handler
 * @param executionDurationMs Time spent in the handler
 * @param completedAt When the attempt finished
 * @param errorMessage Failure description, null on success
 * @param errorCode Stable failure code, null on success
 * @param errorDetails Failure details
 * @param canRetry Whether the delivery may be retried
 * @param retryAfterSeconds Suggested retry delay, null when not retryable
 * @param metadata Handler-specific delivery details
 */
public record OutputHandlerResult(
    OutputHandlerStatus status,
    boolean success,
    String handlerName,
    String destination,
    long executionDurationMs,
    Instant completedAt,
    String errorMessage,
    String errorCode,
    Map<String, Object> errorDetails,
    boolean canRetry,
    Integer retryAfterSeconds,
    Map<String, Object> metadata
) {
    public OutputHandlerResult {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (status == OutputHandlerStatus.SKIPPED && !success) {
            throw new IllegalArgumentException("skipped results must be successful");
        }
        completedAt = completedAt != null ? completedAt : Instant.now();
        errorDetails = immutableCopy(errorDetails);
        metadata = immutableCopy(metadata);
    }

    public static OutputHandlerResult success(String handlerName, String destination,
                                              long executionDurationMs, Map<String, Object> metadata) {
        return new OutputHandlerResult(
            OutputHandlerStatus.SUCCESS, true, handlerName, destination, executionDurationMs,
            Instant.now(), null, null, Map.of(), false, null, metadata);
    }

    /**
     * Failed result. The status is {@code retryable_error} when the delivery may
     * be retried and {@code failed} otherwise.
     */
    public static OutputHandlerResult failure(String handlerName, String destination, long executionDurationMs,
                                              String errorMessage, String errorCode, boolean canRetry,
                                              Integer retryAfterSeconds, Map<String, Object> errorDetails) {
        return new OutputHandlerResult(
            canRetry ? OutputHandlerStatus.RETRYABLE_ERROR : OutputHandlerStatus.FAILED,
            false, handlerName, destination, executionDurationMs, Instant.now(),
            errorMessage, errorCode, errorDetails, canRetry, retryAfterSeconds, Map.of());
    }

    public static OutputHandlerResult skipped(String handlerName, String destination, String reason) {
        return new OutputHandlerResult(
            OutputHandlerStatus.SKIPPED, true, handlerName, destination, 0L, Instant.now(),
            null, null, Map.of(), false, null, Map.of("skip_reason", reason));
    }

    /**
     * Summary recorded in the processing result metadata.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("handler_name", handlerName);
        summary.put("destination", destination);
        summary.put("success", success);
        summary.put("status", status.getValue());
        summary.put("execution_duration_ms", executionDurationMs);
        summary.put("error_code", errorCode);
        summary.put("error_message", errorMessage);
        return summary;
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        // values may be null, so Map.copyOf is not an option
        return Collections.unmodifiableMap(new HashMap<>(source));
    }
}
