package com.chainfeed.subscription.snapshot;

import com.chainfeed.domain.TopicKey;

/**
 * Progress of one topic. Written only by that topic's snapshot worker; read by anyone.
 */
public final class TopicState {

    private final TopicKey key;
    private volatile long lastSyncedTimestamp;

    public TopicState(TopicKey key, long lastSyncedTimestamp) {
        this.key = key;
        this.lastSyncedTimestamp = lastSyncedTimestamp;
    }

    public TopicKey getKey() {
        return key;
    }

    public long getLastSyncedTimestamp() {
        return lastSyncedTimestamp;
    }

    void advanceTo(long timestamp) {
        this.lastSyncedTimestamp = timestamp;
    }

    @Override
    public String toString() {
        return key + "@" + lastSyncedTimestamp;
    }
}
