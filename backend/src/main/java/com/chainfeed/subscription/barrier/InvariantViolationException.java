package com.chainfeed.subscription.barrier;

/**
 * A completion the barrier must never receive: unknown topic, duplicate, or after release.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
