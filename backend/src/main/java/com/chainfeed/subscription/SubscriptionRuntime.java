package com.chainfeed.subscription;

import com.chainfeed.common.RetryPolicy;
import com.chainfeed.subscription.remote.GatewayClient;
import com.chainfeed.subscription.transport.BroadcastParser;
import com.chainfeed.subscription.transport.BroadcastTransportFactory;
import io.github.resilience4j.ratelimiter.RateLimiter;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators and thread pools shared by the tasks of a subscriber.
 *
 * @param snapshotExecutor runs one snapshot worker per topic
 * @param liveExecutor     runs the live loop and the heartbeat probe loop
 * @param scheduler        runs the heartbeat watchdog timer
 */
public record SubscriptionRuntime(GatewayClient gatewayClient,
                                  BroadcastTransportFactory transportFactory,
                                  BroadcastParser parser,
                                  RetryPolicy retryPolicy,
                                  RateLimiter rateLimiter,
                                  Executor snapshotExecutor,
                                  Executor liveExecutor,
                                  ScheduledExecutorService scheduler,
                                  SubscriptionSettings settings) {
}
