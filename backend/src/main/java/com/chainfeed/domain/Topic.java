package com.chainfeed.domain;

/**
 * Smart contract resolved by the gateway for this subscriber.
 *
 * @param key                     topic key
 * @param filterString            categorizer topic string (organization, project, network, group, name)
 * @param preDeployBlockTimestamp checkpoint used when the store has none for this topic
 */
public record Topic(TopicKey key, String filterString, long preDeployBlockTimestamp) {
}
