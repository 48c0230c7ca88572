package com.ivamare.exchange.transport;

/**
 * Creates bus clients on first use.
 */
@FunctionalInterface
public interface BusClientFactory {

    /**
     * @throws RuntimeException if the client cannot be constructed
     */
    BusClient create();
}
