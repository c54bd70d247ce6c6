package com.chainfeed.subscription;

import com.chainfeed.common.RetryPolicy;
import com.chainfeed.config.AsyncConfig;
import com.chainfeed.domain.SubscriptionFilterSettingRepository;
import com.chainfeed.domain.TopicCheckpointRepository;
import com.chainfeed.subscription.config.BroadcastProperties;
import com.chainfeed.subscription.config.HeartbeatProperties;
import com.chainfeed.subscription.config.SubscriberProperties;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.snapshot.TopicState;
import com.chainfeed.subscription.store.MongoProgressStore;
import com.chainfeed.subscription.store.ProgressStore;
import com.chainfeed.subscription.transport.BroadcastParser;
import com.chainfeed.subscription.transport.BroadcastTransportFactory;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates subscribers: resolves topics for the identity's filter, seeds checkpoints and hands the shared
 * runtime to a new {@link Subscriber}. The returned subscriber is not started.
 */
@Slf4j
@Component
public class SubscriberFactory {

    private final SubscriberProperties subscriberProperties;
    private final TopicCheckpointRepository checkpointRepository;
    private final SubscriptionFilterSettingRepository filterSettingRepository;
    private final SubscriptionRuntime runtime;

    public SubscriberFactory(SubscriberProperties subscriberProperties,
                             BroadcastProperties broadcastProperties,
                             HeartbeatProperties heartbeatProperties,
                             TopicCheckpointRepository checkpointRepository,
                             SubscriptionFilterSettingRepository filterSettingRepository,
                             GatewayClient gatewayClient,
                             BroadcastTransportFactory transportFactory,
                             BroadcastParser parser,
                             @Qualifier("snapshotRetryPolicy") RetryPolicy retryPolicy,
                             @Qualifier("gatewayRateLimiter") RateLimiter rateLimiter,
                             @Qualifier(AsyncConfig.SNAPSHOT_EXECUTOR) Executor snapshotExecutor,
                             @Qualifier(AsyncConfig.LIVE_EXECUTOR) Executor liveExecutor,
                             @Qualifier(AsyncConfig.HEARTBEAT_SCHEDULER) ScheduledExecutorService heartbeatScheduler) {
        this.subscriberProperties = subscriberProperties;
        this.checkpointRepository = checkpointRepository;
        this.filterSettingRepository = filterSettingRepository;
        SubscriptionSettings settings = new SubscriptionSettings(
                Math.max(1, subscriberProperties.getPageSize()),
                Duration.ofMillis(broadcastProperties.getPollTimeoutMs()),
                Duration.ofMillis(broadcastProperties.getReceiveErrorPauseMs()),
                Duration.ofMillis(heartbeatProperties.getIntervalMs()),
                Duration.ofMillis(heartbeatProperties.getTimeoutMs()));
        this.runtime = new SubscriptionRuntime(gatewayClient, transportFactory, parser, retryPolicy, rateLimiter,
                snapshotExecutor, liveExecutor, heartbeatScheduler, settings);
    }

    /** Subscriber for the configured identity. */
    public Subscriber create() {
        String identity = subscriberProperties.getIdentity();
        if (identity == null || identity.isBlank()) {
            throw new IllegalStateException("chainfeed.subscriber.identity is not configured");
        }
        return create(identity);
    }

    /** Subscriber whose progress lives in MongoDB under the given identity. */
    public Subscriber create(String identity) {
        return create(identity, new MongoProgressStore(identity, checkpointRepository, filterSettingRepository));
    }

    /**
     * @throws ResolutionException if the gateway cannot resolve topics
     * @throws com.chainfeed.subscription.store.StoreException if stored progress cannot be read or written
     */
    public Subscriber create(String identity, ProgressStore progressStore) {
        List<TopicState> topics = new TopicLoader(runtime.gatewayClient(), progressStore,
                subscriberProperties.getTopicFilter()).load();
        log.info("Created subscriber {} with {} topic(s)", identity, topics.size());
        return new Subscriber(identity, topics, progressStore, runtime);
    }
}
