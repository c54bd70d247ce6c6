package com.chainfeed.subscription.heartbeat;

import com.chainfeed.common.CancellationToken;
import com.chainfeed.common.OutputChannel;
import com.chainfeed.domain.HealthSignal;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.remote.GatewayException;
import com.chainfeed.subscription.remote.GatewayReply;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Watchdog over the gateway. A probe loop checks liveness every interval and resets a deadline timer on
 * success; the timer guards against a probe that never returns. The first failure from either path moves
 * the monitor to FAILED, pushes one {@link HealthSignal} and stops everything else.
 */
@Slf4j
public class HeartbeatMonitor {

    static final String NOT_RESPONDING = "Server is not responding";

    private final GatewayClient gatewayClient;
    private final OutputChannel<HealthSignal> health;
    private final ScheduledExecutorService scheduler;
    private final Executor probeExecutor;
    private final Duration interval;
    private final Duration timeout;
    private final CancellationToken cancellation;
    private final Consumer<HealthSignal> onFailure;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private ScheduledFuture<?> watchdog;

    public HeartbeatMonitor(GatewayClient gatewayClient, OutputChannel<HealthSignal> health,
                            ScheduledExecutorService scheduler, Executor probeExecutor,
                            Duration interval, Duration timeout,
                            CancellationToken cancellation, Consumer<HealthSignal> onFailure) {
        this.gatewayClient = gatewayClient;
        this.health = health;
        this.scheduler = scheduler;
        this.probeExecutor = probeExecutor;
        this.interval = interval;
        this.timeout = timeout;
        this.cancellation = cancellation;
        this.onFailure = onFailure;
    }

    public void start() {
        if (!state.compareAndSet(State.IDLE, State.HEALTHY)) {
            throw new IllegalStateException("Heartbeat monitor already started");
        }
        cancellation.onCancel(this::stop);
        resetWatchdog();
        probeExecutor.execute(this::probeLoop);
    }

    public State getState() {
        return state.get();
    }

    private void probeLoop() {
        while (state.get() == State.HEALTHY && !cancellation.isCancelled()) {
            GatewayReply reply;
            try {
                reply = gatewayClient.probeLiveness();
            } catch (GatewayException e) {
                fail(HealthSignal.Reason.PROBE_FAILED, "Heartbeat failed: " + e.getMessage());
                return;
            }
            if (!reply.isOk()) {
                fail(HealthSignal.Reason.PROBE_FAILED, reply.message());
                return;
            }
            resetWatchdog();
            if (!cancellation.sleep(interval)) {
                return;
            }
        }
    }

    private synchronized void resetWatchdog() {
        if (state.get() != State.HEALTHY) {
            return;
        }
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        watchdog = scheduler.schedule(
                () -> fail(HealthSignal.Reason.PROBE_TIMEOUT, NOT_RESPONDING),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void cancelWatchdog() {
        if (watchdog != null) {
            watchdog.cancel(false);
            watchdog = null;
        }
    }

    private void fail(HealthSignal.Reason reason, String message) {
        if (!state.compareAndSet(State.HEALTHY, State.FAILED)) {
            return;
        }
        cancelWatchdog();
        HealthSignal signal = HealthSignal.of(reason, message);
        log.error("Heartbeat {}: {}", reason, message);
        health.publish(signal);
        onFailure.accept(signal);
    }

    /**
     * Stops probing without emitting a signal. No-op once FAILED.
     */
    public void stop() {
        if (state.compareAndSet(State.HEALTHY, State.STOPPED) || state.compareAndSet(State.IDLE, State.STOPPED)) {
            cancelWatchdog();
        }
    }

    public enum State {
        IDLE,
        HEALTHY,
        FAILED,
        STOPPED
    }
}
