package com.chainfeed.subscription.store;

import com.chainfeed.domain.SubscriptionFilterSetting;
import com.chainfeed.domain.SubscriptionFilterSettingRepository;
import com.chainfeed.domain.TopicCheckpoint;
import com.chainfeed.domain.TopicCheckpointRepository;
import com.chainfeed.domain.TopicFilter;
import com.chainfeed.domain.TopicKey;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * MongoDB-backed progress for one subscriber identity (topic_checkpoint, subscription_filter).
 */
public class MongoProgressStore implements ProgressStore {

    private final String identity;
    private final TopicCheckpointRepository checkpointRepository;
    private final SubscriptionFilterSettingRepository filterRepository;

    public MongoProgressStore(String identity,
                              TopicCheckpointRepository checkpointRepository,
                              SubscriptionFilterSettingRepository filterRepository) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        this.identity = identity;
        this.checkpointRepository = checkpointRepository;
        this.filterRepository = filterRepository;
    }

    @Override
    public Optional<Long> getCheckpoint(TopicKey key) {
        return read("checkpoint of " + key, () -> find(key).map(TopicCheckpoint::getLastSyncedTimestamp));
    }

    @Override
    public void setCheckpoint(TopicKey key, long timestamp) {
        update(key, "checkpoint", c -> c.setLastSyncedTimestamp(timestamp));
    }

    @Override
    public Optional<String> getFilterString(TopicKey key) {
        return read("filter string of " + key, () -> find(key).map(TopicCheckpoint::getFilterString));
    }

    @Override
    public void setFilterString(TopicKey key, String filterString) {
        update(key, "filter string", c -> c.setFilterString(filterString));
    }

    @Override
    public Optional<TopicFilter> getTopicFilter() {
        return read("topic filter", () -> filterRepository.findById(identity).map(SubscriptionFilterSetting::getFilter));
    }

    @Override
    public void setTopicFilter(TopicFilter filter) {
        SubscriptionFilterSetting setting = new SubscriptionFilterSetting();
        setting.setId(identity);
        setting.setFilter(filter);
        setting.setUpdatedAt(Instant.now());
        try {
            filterRepository.save(setting);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to save topic filter for " + identity + ": " + e.getMessage(), e);
        }
    }

    private Optional<TopicCheckpoint> find(TopicKey key) {
        return checkpointRepository.findByIdentityAndTopicKey(identity, key.value());
    }

    private <T> Optional<T> read(String what, Supplier<Optional<T>> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read " + what + " for " + identity + ": " + e.getMessage(), e);
        }
    }

    private void update(TopicKey key, String what, Consumer<TopicCheckpoint> change) {
        try {
            TopicCheckpoint checkpoint = find(key).orElseGet(() -> {
                TopicCheckpoint c = new TopicCheckpoint();
                c.setId(TopicCheckpoint.idOf(identity, key.value()));
                c.setIdentity(identity);
                c.setTopicKey(key.value());
                return c;
            });
            change.accept(checkpoint);
            checkpoint.setUpdatedAt(Instant.now());
            checkpointRepository.save(checkpoint);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to save " + what + " of " + key + " for " + identity + ": " + e.getMessage(), e);
        }
    }
}
