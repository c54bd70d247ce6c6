package com.chainfeed.subscription;

/**
 * The gateway could not resolve the subscriber's topic set.
 */
public class ResolutionException extends RuntimeException {

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
