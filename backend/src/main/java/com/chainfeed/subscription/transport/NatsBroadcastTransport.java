package com.chainfeed.subscription.transport;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NATS core transport. A dispatcher pushes every message of the subscribed subjects into an in-memory
 * inbox, so broadcasts published during backfill wait there until the live loop drains them.
 */
@Slf4j
public class NatsBroadcastTransport implements BroadcastTransport {

    private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

    private final Connection connection;
    private final String subjectPrefix;
    private final Dispatcher dispatcher;
    private final BlockingQueue<TransportMessage> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public NatsBroadcastTransport(Connection connection, String subjectPrefix) {
        this.connection = connection;
        this.subjectPrefix = subjectPrefix;
        this.dispatcher = connection.createDispatcher(msg ->
                inbox.add(new TransportMessage(msg.getSubject(), msg.getData())));
    }

    String subjectFor(String filter) {
        return subjectPrefix == null || subjectPrefix.isBlank() ? filter : subjectPrefix + "." + filter;
    }

    @Override
    public void subscribe(String filter) {
        if (closed.get()) {
            throw new TransportException("Transport already closed");
        }
        String subject = subjectFor(filter);
        try {
            dispatcher.subscribe(subject);
            connection.flush(FLUSH_TIMEOUT);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new TransportException("Failed to subscribe to " + subject + ": " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new TransportException("Subscription to " + subject + " not confirmed in " + FLUSH_TIMEOUT, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while subscribing to " + subject, e);
        }
        log.debug("Subscribed to {}", subject);
    }

    @Override
    public TransportMessage receive(Duration timeout) {
        if (closed.get()) {
            return TransportMessage.terminal();
        }
        TransportMessage message;
        try {
            message = inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while receiving", e);
        }
        if (message != null) {
            return message;
        }
        if (connection.getStatus() == Connection.Status.CLOSED) {
            return TransportMessage.terminal();
        }
        return null;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            connection.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing NATS connection {}", connection.getConnectedUrl());
        }
    }
}
