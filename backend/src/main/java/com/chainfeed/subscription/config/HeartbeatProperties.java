package com.chainfeed.subscription.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chainfeed.heartbeat")
@NoArgsConstructor
@Getter
@Setter
public class HeartbeatProperties {

    /** Pause between successful liveness probes. */
    private long intervalMs = 2_000L;

    /** Watchdog deadline; reset by every successful probe. */
    private long timeoutMs = 10_000L;
}
