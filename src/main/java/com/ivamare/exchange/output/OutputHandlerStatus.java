package com.ivamare.exchange.output;

/**
 * Outcome of a single delivery attempt.
 */
public enum OutputHandlerStatus {
    SUCCESS("success"),
    FAILED("failed"),
    RETRYABLE_ERROR("retryable_error"),
    SKIPPED("skipped"),
    PARTIAL_SUCCESS("partial_success");

    private final String value;

    OutputHandlerStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OutputHandlerStatus fromValue(String value) {
        for (OutputHandlerStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown output handler status: " + value);
    }
}
