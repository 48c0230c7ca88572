package com.ivamare.exchange.exception;

/**
 * Stable error codes reported in results and dead-letter envelopes.
 */
public final class ErrorCodes {

    private ErrorCodes() {
        // Constants only
    }

    // Generic
    public static final String OUTPUT_HANDLER_ERROR = "OUTPUT_HANDLER_ERROR";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";
    public static final String HANDLER_EXECUTION_ERROR = "HANDLER_EXECUTION_ERROR";
    public static final String MESSAGE_SERIALIZATION_FAILED = "MESSAGE_SERIALIZATION_FAILED";

    // Processing
    public static final String MISSING_TENANT_ID = "MISSING_TENANT_ID";
    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    public static final String OUTPUT_DELIVERY_FAILED = "OUTPUT_DELIVERY_FAILED";
    public static final String ROUTING_ERROR = "ROUTING_ERROR";

    // Queue transport
    public static final String QUEUE_CLIENT_CREATION_FAILED = "QUEUE_CLIENT_CREATION_FAILED";
    public static final String QUEUE_NOT_FOUND = "QUEUE_NOT_FOUND";
    public static final String QUEUE_CREATION_FAILED = "QUEUE_CREATION_FAILED";
    public static final String QUEUE_SERVICE_ERROR = "QUEUE_SERVICE_ERROR";
    public static final String QUEUE_SEND_FAILED = "QUEUE_SEND_FAILED";

    // Bus transport
    public static final String SERVICE_BUS_CLIENT_CREATION_FAILED = "SERVICE_BUS_CLIENT_CREATION_FAILED";
    public static final String SERVICE_BUS_SERVICE_ERROR = "SERVICE_BUS_SERVICE_ERROR";
    public static final String SERVICE_BUS_SEND_FAILED = "SERVICE_BUS_SEND_FAILED";
    public static final String MESSAGE_PREPARATION_FAILED = "MESSAGE_PREPARATION_FAILED";
    public static final String UNSUPPORTED_DESTINATION_TYPE = "UNSUPPORTED_DESTINATION_TYPE";

    // File output
    public static final String FILE_WRITE_FAILED = "FILE_WRITE_FAILED";
    public static final String DIRECTORY_NOT_FOUND = "DIRECTORY_NOT_FOUND";
    public static final String FILE_PERMISSION_DENIED = "FILE_PERMISSION_DENIED";
    public static final String INVALID_FILE_PATTERN = "INVALID_FILE_PATTERN";

    // Hashing
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
}
