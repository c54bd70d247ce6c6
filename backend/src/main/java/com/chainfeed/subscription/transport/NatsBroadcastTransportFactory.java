package com.chainfeed.subscription.transport;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens one NATS connection per subscriber, named after the subscriber identity.
 */
@Slf4j
@RequiredArgsConstructor
public class NatsBroadcastTransportFactory implements BroadcastTransportFactory {

    private final String url;
    private final String subjectPrefix;
    private final Duration connectionTimeout;

    @Override
    public BroadcastTransport open(String identity) {
        Options options = new Options.Builder()
                .server(url)
                .connectionName(identity)
                .connectionTimeout(connectionTimeout)
                .build();
        try {
            Connection connection = Nats.connect(options);
            log.info("Connected to broadcast transport (url={}, identity={})", url, identity);
            return new NatsBroadcastTransport(connection, subjectPrefix);
        } catch (IOException e) {
            throw new TransportException("Failed to connect to " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + url, e);
        }
    }
}
