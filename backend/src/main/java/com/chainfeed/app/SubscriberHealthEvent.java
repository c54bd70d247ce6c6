package com.chainfeed.app;

import com.chainfeed.domain.HealthSignal;

/**
 * Published when the auto-started subscriber reports a failure.
 */
public record SubscriberHealthEvent(String identity, HealthSignal signal) {
}
