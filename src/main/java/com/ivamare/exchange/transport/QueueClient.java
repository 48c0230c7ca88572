package com.ivamare.exchange.transport;

/**
 * Producer side of a point-to-point queue transport.
 */
public interface QueueClient {

    /**
     * Send a message body to a named queue.
     *
     * @param destination queue name
     * @param body serialized message
     * @param timeToLiveSeconds message lifetime, null for the transport default
     * @return transport-assigned message id
     * @throws DestinationNotFoundException if the queue does not exist
     */
    String send(String destination, String body, Integer timeToLiveSeconds);

    /**
     * Create the queue if it does not exist yet. Idempotent.
     */
    void ensureExists(String destination);
}
