package com.chainfeed.subscription.transport;

/**
 * Broadcast payload that cannot be turned into a {@link com.chainfeed.domain.BroadcastEvent}.
 */
public class BroadcastParseException extends RuntimeException {

    public BroadcastParseException(String message) {
        super(message);
    }

    public BroadcastParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
