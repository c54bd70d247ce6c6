package com.chainfeed.subscription.live;

import com.chainfeed.common.CancellationToken;
import com.chainfeed.common.OutputChannel;
import com.chainfeed.domain.BroadcastEvent;
import com.chainfeed.subscription.transport.BroadcastParseException;
import com.chainfeed.subscription.transport.BroadcastParser;
import com.chainfeed.subscription.transport.BroadcastTransport;
import com.chainfeed.subscription.transport.TransportException;
import com.chainfeed.subscription.transport.TransportMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Drains the already-subscribed broadcast transport into the event channel. Owns the transport and closes
 * it on exit. Exits on the transport's closed sentinel, on a parse failure (after forwarding a failure
 * event), after forwarding a non-OK broadcast, or on cancellation.
 */
@Slf4j
public class LiveLoop implements Runnable {

    private final BroadcastTransport transport;
    private final BroadcastParser parser;
    private final OutputChannel<BroadcastEvent> events;
    private final String identity;
    private final Duration pollTimeout;
    private final Duration errorPause;
    private final CancellationToken cancellation;
    private final Runnable onExit;

    public LiveLoop(BroadcastTransport transport, BroadcastParser parser, OutputChannel<BroadcastEvent> events,
                    String identity, Duration pollTimeout, Duration errorPause,
                    CancellationToken cancellation, Runnable onExit) {
        this.transport = transport;
        this.parser = parser;
        this.events = events;
        this.identity = identity;
        this.pollTimeout = pollTimeout;
        this.errorPause = errorPause;
        this.cancellation = cancellation;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        log.info("Live loop started for {}", identity);
        ExitReason reason = ExitReason.CANCELLED;
        try {
            reason = loop();
        } finally {
            transport.close();
            log.info("Live loop for {} exited: {}", identity, reason);
            onExit.run();
        }
    }

    private ExitReason loop() {
        while (!cancellation.isCancelled()) {
            TransportMessage message;
            try {
                message = transport.receive(pollTimeout);
            } catch (TransportException e) {
                log.warn("Broadcast receive failed for {}: {}", identity, e.getMessage());
                cancellation.sleep(errorPause);
                continue;
            }
            if (message == null) {
                continue;
            }
            if (message.isTerminal()) {
                return ExitReason.TRANSPORT_CLOSED;
            }
            BroadcastEvent event;
            try {
                event = parser.parse(message);
            } catch (BroadcastParseException e) {
                log.error("Unparseable broadcast on {}: {}", message.subject(), e.getMessage());
                events.publish(BroadcastEvent.fail(identity, "Error when parsing message " + e.getMessage()));
                return ExitReason.PARSE_FAILURE;
            } catch (RuntimeException e) {
                log.error("Broadcast on {} could not be decoded", message.subject(), e);
                events.publish(BroadcastEvent.fail(identity, "Error when parsing message " + e));
                return ExitReason.PARSE_FAILURE;
            }
            events.publish(event);
            if (!event.isOk()) {
                log.warn("Broadcast for {} reported {}: {}", event.topic(), event.status(), event.message());
                return ExitReason.FAILED_BROADCAST;
            }
        }
        return ExitReason.CANCELLED;
    }

    enum ExitReason {
        TRANSPORT_CLOSED,
        PARSE_FAILURE,
        FAILED_BROADCAST,
        CANCELLED
    }
}
