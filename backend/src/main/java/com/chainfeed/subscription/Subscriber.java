package com.chainfeed.subscription;

import com.chainfeed.common.CancellationToken;
import com.chainfeed.common.ChannelReader;
import com.chainfeed.common.OutputChannel;
import com.chainfeed.domain.BroadcastEvent;
import com.chainfeed.domain.HealthSignal;
import com.chainfeed.domain.TopicKey;
import com.chainfeed.subscription.barrier.BarrierOutcome;
import com.chainfeed.subscription.barrier.CompletionBarrier;
import com.chainfeed.subscription.heartbeat.HeartbeatMonitor;
import com.chainfeed.subscription.live.LiveLoop;
import com.chainfeed.subscription.snapshot.SnapshotWorker;
import com.chainfeed.subscription.snapshot.TopicState;
import com.chainfeed.subscription.store.ProgressStore;
import com.chainfeed.subscription.transport.BroadcastTransport;
import com.chainfeed.subscription.transport.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Reads smart-contract events for a fixed topic set: backfills every topic from its checkpoint, then tails
 * the live broadcast stream while a heartbeat watches the gateway.
 *
 * <p>The transport is subscribed to every topic before the first snapshot request, so nothing published
 * during backfill is lost. The price is a possible overlap: events near the end of backfill may be
 * delivered again by the live stream. Consumers of {@link #events()} must de-duplicate by topic and
 * block timestamp.
 *
 * <p>{@link #health()} carries at most one failure signal; after it no further events are guaranteed.
 */
@Slf4j
public class Subscriber {

    private final String identity;
    private final List<TopicState> topics;
    private final ProgressStore progressStore;
    private final SubscriptionRuntime runtime;

    private final OutputChannel<BroadcastEvent> events = new OutputChannel<>();
    private final OutputChannel<HealthSignal> health = new OutputChannel<>();
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicReference<SubscriberPhase> phase = new AtomicReference<>(SubscriberPhase.CREATED);

    private volatile BroadcastTransport transport;

    public Subscriber(String identity, List<TopicState> topics, ProgressStore progressStore, SubscriptionRuntime runtime) {
        this.identity = identity;
        this.topics = List.copyOf(topics);
        this.progressStore = progressStore;
        this.runtime = runtime;
    }

    /**
     * Subscribes every topic on a fresh transport connection, then launches the snapshot workers and
     * returns without waiting for them.
     *
     * @throws TransportException if the transport cannot connect or subscribe
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!phase.compareAndSet(SubscriberPhase.CREATED, SubscriberPhase.BACKFILL)) {
            throw new IllegalStateException("Subscriber " + identity + " already started");
        }
        BroadcastTransport opened;
        try {
            opened = runtime.transportFactory().open(identity);
        } catch (TransportException e) {
            phase.set(SubscriberPhase.STOPPED);
            throw e;
        }
        try {
            for (TopicState topic : topics) {
                opened.subscribe(topic.getKey().value());
            }
        } catch (TransportException e) {
            opened.close();
            phase.set(SubscriberPhase.STOPPED);
            throw e;
        }
        this.transport = opened;
        log.info("Subscriber {} subscribed to {} topic(s), starting backfill", identity, topics.size());

        CompletionBarrier barrier = new CompletionBarrier(topicKeys(), this::onBackfillFinished);
        SubscriptionSettings settings = runtime.settings();
        for (TopicState topic : topics) {
            runtime.snapshotExecutor().execute(new SnapshotWorker(
                    topic, runtime.gatewayClient(), progressStore, events, barrier,
                    runtime.retryPolicy(), runtime.rateLimiter(), settings.pageSize(), cancellation));
        }
        barrier.arm();
    }

    private void onBackfillFinished(BarrierOutcome outcome) {
        if (!outcome.isClean()) {
            String failed = outcome.failures().keySet().stream()
                    .map(TopicKey::value)
                    .sorted()
                    .collect(Collectors.joining(", "));
            health.publish(HealthSignal.of(HealthSignal.Reason.BACKFILL_FAILED, "Backfill failed for " + failed));
            stop();
            return;
        }
        if (!phase.compareAndSet(SubscriberPhase.BACKFILL, SubscriberPhase.LIVE)) {
            return;
        }
        SubscriptionSettings settings = runtime.settings();
        try {
            runtime.liveExecutor().execute(new LiveLoop(
                    transport, runtime.parser(), events, identity,
                    settings.pollTimeout(), settings.receiveErrorPause(), cancellation, this::stop));
        } catch (RejectedExecutionException e) {
            failLiveStart("live loop", e);
            // no live loop took ownership of the transport
            transport.close();
            return;
        }
        try {
            new HeartbeatMonitor(runtime.gatewayClient(), health, runtime.scheduler(), runtime.liveExecutor(),
                    settings.heartbeatInterval(), settings.heartbeatTimeout(), cancellation, signal -> stop())
                    .start();
        } catch (RejectedExecutionException e) {
            failLiveStart("heartbeat", e);
        }
    }

    private void failLiveStart(String task, RejectedExecutionException cause) {
        log.error("Subscriber {} could not schedule its {}: {}", identity, task, cause.getMessage());
        health.publish(HealthSignal.of(HealthSignal.Reason.LIVE_START_FAILED,
                "Could not start " + task + ": " + cause.getMessage()));
        stop();
    }

    /**
     * Stops every task of this subscriber. Idempotent.
     */
    public void stop() {
        SubscriberPhase previous = phase.getAndSet(SubscriberPhase.STOPPED);
        if (previous == SubscriberPhase.STOPPED) {
            return;
        }
        log.info("Stopping subscriber {} (was {})", identity, previous);
        cancellation.cancel();
        // once live, the live loop owns the transport and closes it on exit
        if (previous != SubscriberPhase.LIVE && transport != null) {
            transport.close();
        }
    }

    public ChannelReader<BroadcastEvent> events() {
        return events;
    }

    public ChannelReader<HealthSignal> health() {
        return health;
    }

    public SubscriberPhase phase() {
        return phase.get();
    }

    public String getIdentity() {
        return identity;
    }

    public List<TopicKey> topicKeys() {
        return topics.stream().map(TopicState::getKey).collect(Collectors.toList());
    }
}
