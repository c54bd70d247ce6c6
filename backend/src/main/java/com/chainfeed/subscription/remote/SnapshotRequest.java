package com.chainfeed.subscription.remote;

import com.chainfeed.domain.TopicKey;

/**
 * One snapshot page request. {@code toTimestamp == 0} leaves the window open ("now").
 */
public record SnapshotRequest(TopicKey key, long fromTimestamp, long toTimestamp, long page, int pageSize) {
}
