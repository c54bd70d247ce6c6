package com.chainfeed.subscription.transport;

import java.time.Duration;

/**
 * Receive side of the publish/subscribe transport. Messages for subscribed filters are buffered from the
 * moment {@link #subscribe(String)} returns, whether or not anyone is receiving yet.
 */
public interface BroadcastTransport extends AutoCloseable {

    /**
     * Subscribes to one topic filter. Returns once the subscription is registered upstream.
     *
     * @throws TransportException if the subscription cannot be registered
     */
    void subscribe(String filter);

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the message, a {@link TransportMessage#isTerminal() terminal} message once the transport is
     * closed, or null if nothing arrived in time
     * @throws TransportException on receive failure
     */
    TransportMessage receive(Duration timeout);

    /**
     * Idempotent.
     */
    @Override
    void close();
}
