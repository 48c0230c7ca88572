package com.ivamare.exchange.exception;

import java.util.Map;

/**
 * Raised when input data cannot be processed as given.
 *
 * <p>Validation failures are terminal: retrying the same input cannot succeed.
 */
public class ValidationException extends ExchangeException {

    private final String code;
    private final String errorMessage;
    private final String field;
    private final Map<String, Object> details;

    public ValidationException(String code, String message) {
        this(code, message, null, Map.of());
    }

    public ValidationException(String code, String message, String field) {
        this(code, message, field, Map.of());
    }

    public ValidationException(String code, String message, String field, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.field = field;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Name of the offending field, or null when the whole input is at fault.
     */
    public String getField() {
        return field;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
