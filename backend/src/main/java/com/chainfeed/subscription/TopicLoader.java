package com.chainfeed.subscription;

import com.chainfeed.domain.Topic;
import com.chainfeed.domain.TopicFilter;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.remote.GatewayException;
import com.chainfeed.subscription.snapshot.TopicState;
import com.chainfeed.subscription.store.ProgressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the topic set of a new subscriber: resolves smart contracts for the cached (or configured) topic
 * filter, seeds missing checkpoints from each contract's pre-deploy timestamp and caches topic strings.
 */
@Slf4j
@RequiredArgsConstructor
public class TopicLoader {

    private final GatewayClient gatewayClient;
    private final ProgressStore progressStore;
    private final TopicFilter configuredFilter;

    /**
     * @throws ResolutionException if the gateway cannot resolve the topics
     * @throws com.chainfeed.subscription.store.StoreException if progress cannot be read or written
     */
    public List<TopicState> load() {
        TopicFilter filter = progressStore.getTopicFilter().orElse(null);
        if (filter == null) {
            filter = configuredFilter != null ? configuredFilter : new TopicFilter();
            progressStore.setTopicFilter(filter);
        }

        List<Topic> topics;
        try {
            topics = gatewayClient.resolveTopics(filter);
        } catch (GatewayException e) {
            throw new ResolutionException("Failed to resolve topics for " + filter + ": " + e.getMessage(), e);
        }

        List<TopicState> states = new ArrayList<>(topics.size());
        Set<String> seen = new HashSet<>();
        for (Topic topic : topics) {
            if (!seen.add(topic.key().value())) {
                log.warn("Gateway returned {} twice; keeping the first entry", topic.key());
                continue;
            }
            long checkpoint = progressStore.getCheckpoint(topic.key()).orElse(0L);
            if (checkpoint == 0) {
                checkpoint = topic.preDeployBlockTimestamp();
                progressStore.setCheckpoint(topic.key(), checkpoint);
                log.debug("Seeded checkpoint of {} with pre-deploy timestamp {}", topic.key(), checkpoint);
            }
            progressStore.setFilterString(topic.key(), topic.filterString());
            states.add(new TopicState(topic.key(), checkpoint));
        }
        log.info("Resolved {} topic(s) for filter {}", states.size(), filter);
        return states;
    }
}
