package com.chainfeed.subscription.config;

import com.chainfeed.common.RetryPolicy;
import com.chainfeed.subscription.codec.EventBatchCodec;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.remote.WebClientGatewayClient;
import com.chainfeed.subscription.transport.BroadcastTransportFactory;
import com.chainfeed.subscription.transport.NatsBroadcastTransportFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the gateway client, its rate limiter, the snapshot retry policy and the broadcast transport.
 */
@Configuration
@EnableConfigurationProperties({ SubscriberProperties.class, SnapshotRetryProperties.class, GatewayProperties.class,
        BroadcastProperties.class, HeartbeatProperties.class })
public class SubscriptionAdapterConfig {

    @Bean
    public GatewayClient gatewayClient(WebClient.Builder webClientBuilder, GatewayProperties properties,
                                       ObjectMapper objectMapper, EventBatchCodec eventBatchCodec) {
        return new WebClientGatewayClient(webClientBuilder, properties.getUrl(),
                Duration.ofMillis(properties.getRequestTimeoutMs()), objectMapper, eventBatchCodec);
    }

    /** Shared by every snapshot worker of every subscriber in this process. */
    @Bean(name = "gatewayRateLimiter")
    public RateLimiter gatewayRateLimiter(GatewayProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("gateway", config);
    }

    @Bean(name = "snapshotRetryPolicy")
    public RetryPolicy snapshotRetryPolicy(SnapshotRetryProperties properties) {
        return new RetryPolicy(properties.getBaseDelayMs(), properties.getMaxDelayMs(),
                properties.getJitterFactor(), properties.getMaxAttempts());
    }

    @Bean
    public BroadcastTransportFactory broadcastTransportFactory(BroadcastProperties properties) {
        return new NatsBroadcastTransportFactory(properties.getUrl(), properties.getSubjectPrefix(),
                Duration.ofMillis(properties.getConnectionTimeoutMs()));
    }
}
