package com.chainfeed.domain;

/**
 * Item of the event-output channel. Backfill pages and live broadcasts both arrive as this type.
 * Consumers must tolerate duplicates across the backfill/live seam and de-duplicate by topic and timestamp.
 *
 * @param topic   topic key string, or the subscriber identity for subscriber-wide failures
 * @param status  {@link ReplyStatus#OK} or {@link ReplyStatus#FAIL}
 * @param message failure detail; empty when OK
 * @param payload batch of events; null on failure
 */
public record BroadcastEvent(String topic, String status, String message, EventBatch payload) {

    public static BroadcastEvent ok(String topic, EventBatch payload) {
        return new BroadcastEvent(topic, ReplyStatus.OK, "", payload);
    }

    public static BroadcastEvent fail(String topic, String message) {
        return new BroadcastEvent(topic, ReplyStatus.FAIL, message, null);
    }

    public boolean isOk() {
        return ReplyStatus.isOk(status);
    }
}
