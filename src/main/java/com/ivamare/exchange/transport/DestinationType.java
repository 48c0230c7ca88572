package com.ivamare.exchange.transport;

/**
 * Kind of bus entity a message is sent to.
 */
public enum DestinationType {
    QUEUE("queue"),
    TOPIC("topic");

    private final String value;

    DestinationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DestinationType fromValue(String value) {
        for (DestinationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported destination type: " + value);
    }
}
