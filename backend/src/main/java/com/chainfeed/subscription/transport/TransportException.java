package com.chainfeed.subscription.transport;

/**
 * Connection, subscribe or receive failure on the broadcast transport.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
