package com.ivamare.exchange.transport;

/**
 * Producer side of a publish/subscribe bus transport.
 */
public interface BusClient {

    /**
     * Publish a message.
     *
     * @return the id under which the broker accepted the message
     */
    String send(BusMessage message);
}
