package com.chainfeed.support;

import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.Topic;
import com.chainfeed.domain.TopicFilter;
import com.chainfeed.domain.TopicKey;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.remote.GatewayException;
import com.chainfeed.subscription.remote.GatewayReply;
import com.chainfeed.subscription.remote.SnapshotRequest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Serves pre-built snapshot pages per topic; page n (1-based) is the n-th batch, anything past the last batch
 * is an empty page.
 */
public class FakeGatewayClient implements GatewayClient {

    private final List<Topic> topics = new ArrayList<>();
    private final Map<TopicKey, List<EventBatch>> pages = new ConcurrentHashMap<>();
    private final Set<TopicKey> failing = ConcurrentHashMap.newKeySet();
    private final List<SnapshotRequest> requests = new CopyOnWriteArrayList<>();
    private final List<TopicFilter> resolvedFilters = new CopyOnWriteArrayList<>();
    private final AtomicInteger probes = new AtomicInteger();
    private volatile Supplier<GatewayReply> probe = GatewayReply::ok;
    private volatile Consumer<SnapshotRequest> onFetch = request -> { };
    private volatile GatewayException resolveFailure;

    public FakeGatewayClient withTopic(String networkId, String address, long preDeployBlockTimestamp) {
        TopicKey key = new TopicKey(networkId, address);
        topics.add(new Topic(key, "topic:" + key.value(), preDeployBlockTimestamp));
        return this;
    }

    public FakeGatewayClient withPages(TopicKey key, EventBatch... batches) {
        pages.put(key, Arrays.asList(batches));
        return this;
    }

    public FakeGatewayClient failingFor(TopicKey key) {
        failing.add(key);
        return this;
    }

    public void failResolution(GatewayException failure) {
        this.resolveFailure = failure;
    }

    public void setProbe(Supplier<GatewayReply> probe) {
        this.probe = probe;
    }

    public void setOnFetch(Consumer<SnapshotRequest> onFetch) {
        this.onFetch = onFetch;
    }

    @Override
    public List<Topic> resolveTopics(TopicFilter filter) {
        resolvedFilters.add(filter);
        if (resolveFailure != null) {
            throw resolveFailure;
        }
        return List.copyOf(topics);
    }

    @Override
    public EventBatch fetchPage(SnapshotRequest request) {
        requests.add(request);
        onFetch.accept(request);
        if (failing.contains(request.key())) {
            throw new GatewayException("snapshot unavailable for " + request.key());
        }
        List<EventBatch> batches = pages.getOrDefault(request.key(), List.of());
        int index = (int) request.page() - 1;
        if (index < batches.size()) {
            return batches.get(index);
        }
        return EventBatch.empty(batches.isEmpty() ? 0 : batches.get(0).batchTimestamp());
    }

    @Override
    public GatewayReply probeLiveness() {
        probes.incrementAndGet();
        return probe.get();
    }

    public List<SnapshotRequest> requests() {
        return requests;
    }

    public List<SnapshotRequest> requestsFor(TopicKey key) {
        return requests.stream().filter(r -> r.key().equals(key)).toList();
    }

    public List<TopicFilter> resolvedFilters() {
        return resolvedFilters;
    }

    public int probeCount() {
        return probes.get();
    }
}
