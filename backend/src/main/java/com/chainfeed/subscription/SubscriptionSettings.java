package com.chainfeed.subscription;

import java.time.Duration;

/**
 * Tunables handed to every subscriber task.
 */
public record SubscriptionSettings(int pageSize,
                                   Duration pollTimeout,
                                   Duration receiveErrorPause,
                                   Duration heartbeatInterval,
                                   Duration heartbeatTimeout) {
}
