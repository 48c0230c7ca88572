package com.ivamare.exchange.processor;

import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.model.ProcessorInfo;

/**
 * Business logic invoked once per message.
 *
 * <p>Processors return a {@link ProcessingResult} describing the outcome and
 * attach output handlers to it for delivery. Exceptions thrown from
 * {@link #process} are turned into failed results by the
 * {@link ProcessorHandler}; {@link #canRetry} decides whether they are retried
 * or dead-lettered.
 */
public interface MessageProcessor {

    /**
     * Process a message.
     *
     * @param message The message to process
     * @param context Tenant and services for this execution
     * @return the processing outcome
     * @throws Exception on processing failure
     */
    ProcessingResult process(Message message, ProcessorContext context) throws Exception;

    default boolean validateMessage(Message message) {
        return true;
    }

    default boolean canRetry(Exception error) {
        return false;
    }

    default ProcessorInfo getProcessorInfo() {
        return ProcessorInfo.of(getClass().getSimpleName(), "1.0.0");
    }
}
