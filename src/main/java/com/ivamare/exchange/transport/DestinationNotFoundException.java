package com.ivamare.exchange.transport;

import com.ivamare.exchange.exception.ExchangeException;

/**
 * Raised by a transport when the target destination does not exist.
 */
public class DestinationNotFoundException extends ExchangeException {

    private final String destination;

    public DestinationNotFoundException(String destination) {
        super("Destination does not exist: " + destination);
        this.destination = destination;
    }

    public DestinationNotFoundException(String destination, Throwable cause) {
        super("Destination does not exist: " + destination, cause);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }
}
