package com.ivamare.exchange.processor;

/**
 * How output delivery failures affect the processing result.
 */
public enum DeliveryMode {
    /**
     * Failures are recorded in the result metadata; the result keeps its status.
     */
    BEST_EFFORT,
    /**
     * Any failed output turns the result into a failure with {@code OUTPUT_DELIVERY_FAILED}.
     */
    ALL_REQUIRED
}
