package com.ivamare.exchange.exception;

import com.ivamare.exchange.policy.BackoffPolicy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Raised inside an output handler when a delivery attempt fails.
 *
 * <p>Carries everything needed to build a failed delivery result: a stable
 * error code, whether the attempt may be retried, an optional retry hint
 * and free-form details. Output handlers convert this exception into an
 * {@code OutputHandlerResult}; it never escapes {@code handle()}.
 */
public class OutputDeliveryException extends ExchangeException {

    private static final int MAX_RETRY_DELAY_SECONDS = 300;
    private static final double RETRY_MULTIPLIER = 2.0;

    private final String errorCode;
    private final String errorMessage;
    private final boolean canRetry;
    private final Integer retryAfterSeconds;
    private final Map<String, Object> errorDetails;

    public OutputDeliveryException(String message) {
        this(message, ErrorCodes.OUTPUT_HANDLER_ERROR, false, null, Map.of(), null);
    }

    public OutputDeliveryException(String message, String errorCode, boolean canRetry) {
        this(message, errorCode, canRetry, null, Map.of(), null);
    }

    public OutputDeliveryException(String message, String errorCode, boolean canRetry, Throwable cause) {
        this(message, errorCode, canRetry, null, Map.of(), cause);
    }

    public OutputDeliveryException(String message, String errorCode, boolean canRetry,
                                   Integer retryAfterSeconds, Map<String, Object> errorDetails,
                                   Throwable cause) {
        super("[" + (errorCode != null ? errorCode : ErrorCodes.OUTPUT_HANDLER_ERROR) + "] " + message, cause);
        this.errorCode = errorCode != null ? errorCode : ErrorCodes.OUTPUT_HANDLER_ERROR;
        this.errorMessage = message;
        this.canRetry = canRetry;
        this.retryAfterSeconds = retryAfterSeconds;
        // HashMap copy: details may legitimately contain null values
        this.errorDetails = errorDetails != null
            ? Collections.unmodifiableMap(new HashMap<>(errorDetails))
            : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isCanRetry() {
        return canRetry;
    }

    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public Map<String, Object> getErrorDetails() {
        return errorDetails;
    }

    /**
     * Suggested delay before retrying after the given attempt.
     *
     * @param attempt Zero-based retry attempt
     * @return Delay in seconds
     */
    public int calculateRetryDelay(int attempt) {
        return calculateRetryDelay(attempt, null);
    }

    /**
     * Suggested delay using an explicit base delay.
     *
     * <p>The base is the override when given, otherwise the retry hint,
     * otherwise one second.
     */
    public int calculateRetryDelay(int attempt, Integer baseDelayOverride) {
        return calculateRetryDelay(attempt, baseDelayOverride, ThreadLocalRandom.current());
    }

    public int calculateRetryDelay(int attempt, Integer baseDelayOverride, Random random) {
        int base;
        if (baseDelayOverride != null) {
            base = baseDelayOverride;
        } else if (retryAfterSeconds != null) {
            base = retryAfterSeconds;
        } else {
            base = 1;
        }
        return BackoffPolicy.computeBackoff(
            attempt, base, Math.max(base, MAX_RETRY_DELAY_SECONDS), RETRY_MULTIPLIER, true, random);
    }
}
