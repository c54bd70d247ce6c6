package com.chainfeed.domain;

import java.time.Instant;

/**
 * Terminal failure pushed on the health-output channel. Only failures are ever delivered.
 */
public record HealthSignal(Reason reason, String message, Instant at) {

    public static HealthSignal of(Reason reason, String message) {
        return new HealthSignal(reason, message, Instant.now());
    }

    public String status() {
        return ReplyStatus.FAIL;
    }

    public enum Reason {
        /** Liveness probe returned non-OK or failed in transport. */
        PROBE_FAILED,
        /** No successful probe within the watchdog timeout. */
        PROBE_TIMEOUT,
        /** At least one topic could not finish its backfill. */
        BACKFILL_FAILED,
        /** Live loop or heartbeat could not be scheduled after backfill. */
        LIVE_START_FAILED
    }
}
