package com.ivamare.exchange.output;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.exception.OutputDeliveryException;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.policy.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for output handlers.
 *
 * <p>{@link #handle} is a template: it checks the configuration, times the
 * call to {@link #deliver} and turns every exception into a result.
 * Subclasses signal expected failures by throwing
 * {@link OutputDeliveryException}; retryable failures get a backoff delay
 * computed from the exception's retry hint and the message retry count.
 */
public abstract class AbstractOutputHandler implements OutputHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractOutputHandler.class);

    /**
     * Base delay for failures nobody anticipated.
     */
    protected static final int UNEXPECTED_ERROR_BASE_DELAY = 2;

    static final String BACKOFF_ALGORITHM = "exponential_with_jitter";

    private final String destination;
    private final Map<String, Object> config;
    private final BackoffPolicy backoffPolicy;

    protected AbstractOutputHandler(String destination, Map<String, Object> config, BackoffPolicy backoffPolicy) {
        this.destination = destination;
        this.config = config != null ? Collections.unmodifiableMap(new HashMap<>(config)) : Map.of();
        this.backoffPolicy = backoffPolicy != null ? backoffPolicy : BackoffPolicy.defaultPolicy();
    }

    @Override
    public final OutputHandlerResult handle(Message message, ProcessingResult result) {
        long start = System.nanoTime();

        if (!validateConfiguration()) {
            log.warn("{} has invalid configuration for destination {}", getHandlerName(), destination);
            return OutputHandlerResult.failure(
                getHandlerName(), destination, elapsedMs(start),
                "Invalid configuration for " + getHandlerName() + " (destination: " + destination + ")",
                ErrorCodes.INVALID_CONFIGURATION, false, null, Map.of());
        }

        try {
            Map<String, Object> metadata = deliver(message, result);
            long duration = elapsedMs(start);
            log.debug("{} delivered message {} to {} in {}ms",
                getHandlerName(), message.getMessageId(), destination, duration);
            return OutputHandlerResult.success(getHandlerName(), destination, duration, metadata);
        } catch (OutputDeliveryException e) {
            log.warn("{} failed to deliver message {} to {}: {}",
                getHandlerName(), message.getMessageId(), destination, e.getMessage());
            return failureResult(e, message.getRetryCount(), elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("Unexpected error in {} delivering message {} to {}",
                getHandlerName(), message.getMessageId(), destination, e);
            Map<String, Object> details = new HashMap<>();
            details.put("exception_type", e.getClass().getName());
            OutputDeliveryException wrapped = new OutputDeliveryException(
                "Unexpected error: " + e.getMessage(), ErrorCodes.UNEXPECTED_ERROR, true,
                UNEXPECTED_ERROR_BASE_DELAY, details, e);
            return failureResult(wrapped, message.getRetryCount(), elapsedMs(start));
        }
    }

    /**
     * Perform the delivery.
     *
     * @return metadata describing the delivery, recorded on the success result
     * @throws OutputDeliveryException when the delivery failed
     */
    protected abstract Map<String, Object> deliver(Message message, ProcessingResult result);

    @Override
    public boolean supportsRetry() {
        return true;
    }

    @Override
    public Map<String, Object> getHandlerInfo() {
        List<String> configKeys = new ArrayList<>(config.keySet());
        Collections.sort(configKeys);

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("handler_name", getHandlerName());
        info.put("destination", destination);
        info.put("config_keys", configKeys);
        info.put("supports_retry", supportsRetry());
        return info;
    }

    @Override
    public String getDestination() {
        return destination;
    }

    @Override
    public String getHandlerName() {
        return getClass().getSimpleName();
    }

    protected Map<String, Object> getConfig() {
        return config;
    }

    protected BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    /**
     * Convert a delivery exception into a result. Retryable failures carry the
     * calculated backoff delay and the inputs used to compute it.
     */
    protected OutputHandlerResult failureResult(OutputDeliveryException e, int retryCount, long durationMs) {
        Map<String, Object> details = new HashMap<>(e.getErrorDetails());
        if (!e.isCanRetry()) {
            return OutputHandlerResult.failure(
                getHandlerName(), destination, durationMs,
                e.getErrorMessage(), e.getErrorCode(), false, null, details);
        }

        int base = e.getRetryAfterSeconds() != null ? e.getRetryAfterSeconds() : backoffPolicy.baseDelaySeconds();
        int delay = backoffPolicy.withBaseDelay(base).computeBackoff(retryCount);

        details.put("retry_count", retryCount);
        details.put("calculated_backoff_delay", delay);
        details.put("backoff_algorithm", BACKOFF_ALGORITHM);

        return OutputHandlerResult.failure(
            getHandlerName(), destination, durationMs,
            e.getErrorMessage(), e.getErrorCode(), true, delay, details);
    }

    // --- Configuration access ---

    protected String configString(String key, String defaultValue) {
        Object value = config.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    protected boolean configBoolean(String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    /**
     * Integer setting. Returns the default for a missing key and throws
     * {@link IllegalArgumentException} for a value that is not a number.
     */
    protected Integer configInteger(String key, Integer defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' must be an integer: " + value, e);
        }
    }

    @SuppressWarnings("unchecked")
    protected Map<String, Object> configMap(String key) {
        Object value = config.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
