package com.ivamare.exchange.deadletter;

/**
 * Destination for messages that failed terminally.
 */
@FunctionalInterface
public interface DeadLetterSink {

    /**
     * Forward a dead-letter envelope.
     *
     * @param envelope JSON document with the original message and failure context
     * @throws RuntimeException if the envelope could not be stored
     */
    void send(String envelope);
}
