package com.chainfeed.subscription.barrier;

import com.chainfeed.domain.TopicKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Holds back live mode until every topic's snapshot worker has reported exactly once, then runs the
 * release callback exactly once. Failed completions count towards the total so that one broken topic never
 * blocks the others; the outcome lists them.
 */
@Slf4j
public class CompletionBarrier {

    private final Set<TopicKey> expected;
    private final Set<TopicKey> pending;
    private final Map<TopicKey, Throwable> failures = new LinkedHashMap<>();
    private final Consumer<BarrierOutcome> onRelease;
    private boolean armed;
    private boolean done;

    public CompletionBarrier(Collection<TopicKey> topics, Consumer<BarrierOutcome> onRelease) {
        this.expected = Set.copyOf(topics);
        if (expected.size() != topics.size()) {
            throw new IllegalArgumentException("Duplicate topic keys: " + topics);
        }
        this.pending = new HashSet<>(expected);
        this.onRelease = onRelease;
    }

    /**
     * Enables release. With zero topics this releases immediately; otherwise completions that arrived
     * before arming are already counted.
     */
    public void arm() {
        BarrierOutcome outcome;
        synchronized (this) {
            if (armed) {
                throw new IllegalStateException("Barrier already armed");
            }
            armed = true;
            outcome = releaseIfDone();
        }
        fire(outcome);
    }

    public void complete(TopicKey key) {
        receive(key, null);
    }

    public void fail(TopicKey key, Throwable cause) {
        receive(key, cause != null ? cause : new IllegalStateException("backfill failed"));
    }

    private void receive(TopicKey key, Throwable failure) {
        BarrierOutcome outcome;
        synchronized (this) {
            if (done) {
                throw new InvariantViolationException("Completion for " + key + " after the barrier released");
            }
            if (!expected.contains(key)) {
                throw new InvariantViolationException("Completion for unknown topic " + key);
            }
            if (!pending.remove(key)) {
                throw new InvariantViolationException("Duplicate completion for " + key);
            }
            if (failure != null) {
                failures.put(key, failure);
            }
            log.debug("Barrier received {} ({}), {} remaining", key, failure == null ? "ok" : "failed", pending.size());
            outcome = releaseIfDone();
        }
        fire(outcome);
    }

    private BarrierOutcome releaseIfDone() {
        if (!armed || done || !pending.isEmpty()) {
            return null;
        }
        done = true;
        return new BarrierOutcome(expected.size(), failures);
    }

    private void fire(BarrierOutcome outcome) {
        if (outcome == null) {
            return;
        }
        log.info("Barrier released: {} topic(s), {} failed", outcome.topicCount(), outcome.failures().size());
        onRelease.accept(outcome);
    }

    public synchronized boolean isReleased() {
        return done;
    }

    public synchronized int remaining() {
        return pending.size();
    }
}
