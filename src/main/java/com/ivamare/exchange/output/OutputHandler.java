package com.ivamare.exchange.output;

import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;

import java.util.Map;

/**
 * Delivers the outcome of processing a message to one destination.
 *
 * <p>Implementations must not throw from {@link #handle}: every failure,
 * expected or not, is reported as a failed {@link OutputHandlerResult}.
 */
public interface OutputHandler {

    /**
     * Perform one delivery attempt.
     *
     * @param message the message that was processed
     * @param result the processing result to deliver
     * @return the delivery outcome
     */
    OutputHandlerResult handle(Message message, ProcessingResult result);

    /**
     * Cheap pre-flight check of the handler configuration. Performs no I/O.
     */
    boolean validateConfiguration();

    /**
     * Whether failed deliveries of this handler are worth retrying.
     */
    boolean supportsRetry();

    /**
     * Descriptive information for monitoring.
     */
    Map<String, Object> getHandlerInfo();

    String getDestination();

    String getHandlerName();
}
