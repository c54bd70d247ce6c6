package com.chainfeed.common;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared stop signal for every task of one subscriber. Blocking waits go through {@link #sleep(Duration)}
 * so that {@link #cancel()} wakes them up.
 */
@Slf4j
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Cancels the token and runs registered callbacks once. Later calls are no-ops.
     */
    public void cancel() {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            cancelled.countDown();
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a callback to run on cancellation; runs it immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        boolean runNow;
        synchronized (this) {
            runNow = isCancelled();
            if (!runNow) {
                callbacks.add(callback);
            }
        }
        if (runNow) {
            callback.run();
        }
    }

    /**
     * Sleeps for the given duration unless cancelled first.
     *
     * @return true if the full duration elapsed, false if the token was cancelled
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelled.await(Math.max(0, duration.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
