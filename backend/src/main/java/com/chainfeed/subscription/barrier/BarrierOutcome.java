package com.chainfeed.subscription.barrier;

import com.chainfeed.domain.TopicKey;

import java.util.Map;

/**
 * Result handed to the release callback once every topic reported.
 *
 * @param failures cause per topic whose backfill did not finish; empty on a clean release
 */
public record BarrierOutcome(int topicCount, Map<TopicKey, Throwable> failures) {

    public BarrierOutcome {
        failures = Map.copyOf(failures);
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
