package com.ivamare.exchange.transport;

/**
 * Creates queue clients on first use.
 */
@FunctionalInterface
public interface QueueClientFactory {

    /**
     * @throws RuntimeException if the client cannot be constructed
     */
    QueueClient create();
}
