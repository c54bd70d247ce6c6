package com.chainfeed.subscription.remote;

/**
 * Thrown when a gateway request fails in transport, returns a non-OK status, or cannot be decoded.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
