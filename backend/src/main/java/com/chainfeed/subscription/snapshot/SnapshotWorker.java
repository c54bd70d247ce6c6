package com.chainfeed.subscription.snapshot;

import com.chainfeed.common.CancellationToken;
import com.chainfeed.common.OutputChannel;
import com.chainfeed.common.RetryPolicy;
import com.chainfeed.domain.BroadcastEvent;
import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.TopicKey;
import com.chainfeed.subscription.barrier.CompletionBarrier;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.remote.GatewayException;
import com.chainfeed.subscription.remote.SnapshotRequest;
import com.chainfeed.subscription.store.ProgressStore;
import com.chainfeed.subscription.store.StoreException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Backfills one topic from its checkpoint up to the moment of the first reply, page by page, oldest first.
 * The checkpoint is persisted before each page is published, so a crash can replay at most one page.
 * Reports to the barrier exactly once: success, or failure after the retry budget is spent.
 */
@Slf4j
public class SnapshotWorker implements Runnable {

    private final TopicState state;
    private final GatewayClient gatewayClient;
    private final ProgressStore progressStore;
    private final OutputChannel<BroadcastEvent> events;
    private final CompletionBarrier barrier;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final int pageSize;
    private final CancellationToken cancellation;

    public SnapshotWorker(TopicState state, GatewayClient gatewayClient, ProgressStore progressStore,
                          OutputChannel<BroadcastEvent> events, CompletionBarrier barrier,
                          RetryPolicy retryPolicy, RateLimiter rateLimiter, int pageSize,
                          CancellationToken cancellation) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.state = state;
        this.gatewayClient = gatewayClient;
        this.progressStore = progressStore;
        this.events = events;
        this.barrier = barrier;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.pageSize = pageSize;
        this.cancellation = cancellation;
    }

    @Override
    public void run() {
        TopicKey key = state.getKey();
        long pages;
        try {
            pages = backfill();
        } catch (GatewayException | StoreException e) {
            log.error("Snapshot for {} failed: {}", key, e.getMessage(), e);
            reportFailure(key, e);
            return;
        } catch (RuntimeException e) {
            log.error("Snapshot for {} failed unexpectedly", key, e);
            reportFailure(key, e);
            return;
        }
        if (pages < 0) {
            log.info("Snapshot for {} cancelled", key);
            return;
        }
        log.info("Snapshot for {} complete: {} page(s), checkpoint {}", key, pages, state.getLastSyncedTimestamp());
        barrier.complete(key);
    }

    private void reportFailure(TopicKey key, RuntimeException cause) {
        events.publish(BroadcastEvent.fail(key.value(), "Snapshot failed: " + cause.getMessage()));
        barrier.fail(key, cause);
    }

    /**
     * @return number of non-empty pages delivered, or -1 if cancelled
     */
    private long backfill() {
        TopicKey key = state.getKey();
        long from = state.getLastSyncedTimestamp();
        long to = 0;
        long page = 1;
        while (true) {
            if (cancellation.isCancelled()) {
                return -1;
            }
            EventBatch batch = fetchWithRetry(new SnapshotRequest(key, from, to, page, pageSize));
            if (batch == null) {
                return -1;
            }
            if (batch.isEmpty()) {
                return page - 1;
            }
            long checkpoint = Math.max(state.getLastSyncedTimestamp(),
                    batch.maxBlockTimestamp().orElse(state.getLastSyncedTimestamp()));
            progressStore.setCheckpoint(key, checkpoint);
            state.advanceTo(checkpoint);
            events.publish(BroadcastEvent.ok(key.value(), batch));

            if (to == 0) {
                to = batch.batchTimestamp();
            }
            page++;
        }
    }

    /**
     * @return the page, or null if cancelled while waiting to retry
     */
    private EventBatch fetchWithRetry(SnapshotRequest request) {
        GatewayException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt - 1);
                log.warn("Snapshot page {} for {} failed (attempt {}/{}), retrying in {} ms: {}",
                        request.page(), request.key(), attempt, retryPolicy.getMaxAttempts(), delay, last.getMessage());
                if (!cancellation.sleep(Duration.ofMillis(delay))) {
                    return null;
                }
            }
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new GatewayException("Local limiter timeout before snapshot page " + request.page() + " of " + request.key());
                }
                return gatewayClient.fetchPage(request);
            } catch (GatewayException e) {
                last = e;
            }
        }
        throw new GatewayException("Snapshot page " + request.page() + " for " + request.key() + " failed after "
                + retryPolicy.getMaxAttempts() + " attempt(s): " + last.getMessage(), last);
    }
}
