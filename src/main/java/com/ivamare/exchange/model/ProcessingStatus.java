package com.ivamare.exchange.model;

/**
 * Outcome of processing a message.
 */
public enum ProcessingStatus {
    SUCCESS("success"),
    FAILED("failed"),
    ERROR("error"),
    SKIPPED("skipped"),
    PARTIAL("partial"),
    DEAD_LETTERED("dead_lettered");

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether this status counts as a failed outcome.
     */
    public boolean isFailure() {
        return this == FAILED || this == ERROR || this == DEAD_LETTERED;
    }

    public static ProcessingStatus fromValue(String value) {
        for (ProcessingStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown processing status: " + value);
    }
}
