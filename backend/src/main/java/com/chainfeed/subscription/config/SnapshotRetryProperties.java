package com.chainfeed.subscription.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for snapshot page requests (exponential backoff with jitter).
 */
@ConfigurationProperties(prefix = "chainfeed.snapshot.retry")
@NoArgsConstructor
@Getter
@Setter
public class SnapshotRetryProperties {

    /** Delay before the first retry; doubles each attempt. */
    private long baseDelayMs = 1000L;

    /** Backoff ceiling. */
    private long maxDelayMs = 30_000L;

    /** 0..1, e.g. 0.2 = ±20%. */
    private double jitterFactor = 0.2;

    /** Attempts per page including the first one. After that the topic is reported as failed. */
    private int maxAttempts = 5;
}
