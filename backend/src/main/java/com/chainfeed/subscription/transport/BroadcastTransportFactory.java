package com.chainfeed.subscription.transport;

/**
 * Opens one transport connection per subscriber.
 */
public interface BroadcastTransportFactory {

    /**
     * @param identity subscriber identity, used as the connection name
     * @throws TransportException if the connection cannot be established
     */
    BroadcastTransport open(String identity);
}
