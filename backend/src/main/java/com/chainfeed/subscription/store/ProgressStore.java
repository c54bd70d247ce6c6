package com.chainfeed.subscription.store;

import com.chainfeed.domain.TopicFilter;
import com.chainfeed.domain.TopicKey;

import java.util.Optional;

/**
 * Per-topic progress of one subscriber: last synced block timestamp and cached topic string, plus the
 * subscriber's topic filter. All methods throw {@link StoreException} on failure.
 */
public interface ProgressStore {

    Optional<Long> getCheckpoint(TopicKey key);

    void setCheckpoint(TopicKey key, long timestamp);

    Optional<String> getFilterString(TopicKey key);

    void setFilterString(TopicKey key, String filterString);

    Optional<TopicFilter> getTopicFilter();

    void setTopicFilter(TopicFilter filter);
}
