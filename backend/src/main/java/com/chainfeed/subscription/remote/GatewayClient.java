package com.chainfeed.subscription.remote;

import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.Topic;
import com.chainfeed.domain.TopicFilter;

import java.util.List;

/**
 * Request/reply calls to the gateway. Implementations block the caller until the reply arrives or the
 * request times out.
 */
public interface GatewayClient {

    /**
     * Smart contracts matching the filter, each with its topic string.
     *
     * @throws GatewayException on transport failure, non-OK reply or malformed reply
     */
    List<Topic> resolveTopics(TopicFilter filter);

    /**
     * One page of categorized transactions and logs, oldest first. An empty page ends pagination.
     *
     * @throws GatewayException on transport failure, non-OK reply or malformed reply
     */
    EventBatch fetchPage(SnapshotRequest request);

    /**
     * Liveness probe. A non-OK reply is returned, not thrown.
     *
     * @throws GatewayException on transport failure
     */
    GatewayReply probeLiveness();
}
