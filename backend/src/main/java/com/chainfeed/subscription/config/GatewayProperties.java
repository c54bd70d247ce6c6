package com.chainfeed.subscription.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chainfeed.gateway")
@NoArgsConstructor
@Getter
@Setter
public class GatewayProperties {

    /** Gateway request/reply endpoint. */
    private String url = "http://localhost:4400/";

    private long requestTimeoutMs = 10_000L;

    /** Local cap on snapshot page requests per second, shared by all topics. */
    private int maxRequestsPerSecond = 20;

    /** How long a snapshot request may wait for a local limiter permit. */
    private long localLimiterTimeoutMs = 30_000L;
}
