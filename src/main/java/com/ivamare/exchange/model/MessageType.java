package com.ivamare.exchange.model;

/**
 * Kind of message carried through the exchange.
 */
public enum MessageType {
    ENTITY_PROCESSING("entity_processing"),
    CONTROL_MESSAGE("control_message"),
    ERROR_MESSAGE("error_message"),
    HEARTBEAT("heartbeat"),
    METRICS("metrics");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MessageType fromValue(String value) {
        for (MessageType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}
