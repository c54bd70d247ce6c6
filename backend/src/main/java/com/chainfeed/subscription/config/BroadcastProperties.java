package com.chainfeed.subscription.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Publish/subscribe transport (NATS) carrying live broadcasts.
 */
@ConfigurationProperties(prefix = "chainfeed.broadcast")
@NoArgsConstructor
@Getter
@Setter
public class BroadcastProperties {

    private String url = "nats://localhost:4222";

    /** Subject for a topic is {@code <subjectPrefix>.<topicKey>}. */
    private String subjectPrefix = "chainfeed.broadcast";

    private long connectionTimeoutMs = 5_000L;

    /** Upper bound of a single receive wait; the live loop checks cancellation between waits. */
    private long pollTimeoutMs = 500L;

    /** Pause after a receive error before polling again. */
    private long receiveErrorPauseMs = 250L;
}
