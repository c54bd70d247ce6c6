package com.chainfeed.subscription.transport;

import com.chainfeed.domain.BroadcastEvent;
import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.ReplyStatus;
import com.chainfeed.subscription.codec.EventBatchCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Parses {@code {"topic": ..., "reply": {"status", "message", "parameters"}}} broadcasts.
 */
@Component
@RequiredArgsConstructor
public class BroadcastParser {

    private final ObjectMapper objectMapper;
    private final EventBatchCodec eventBatchCodec;

    public BroadcastEvent parse(TransportMessage message) {
        JsonNode root;
        try {
            root = objectMapper.readTree(message.data());
        } catch (IOException e) {
            throw new BroadcastParseException("not JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new BroadcastParseException("broadcast must be a JSON object");
        }
        String topic = root.path("topic").asText("");
        if (topic.isBlank()) {
            throw new BroadcastParseException("broadcast has no topic");
        }
        JsonNode reply = root.path("reply");
        if (!reply.isObject() || !reply.path("status").isTextual()) {
            throw new BroadcastParseException("broadcast for " + topic + " has no reply status");
        }
        String status = reply.get("status").asText();
        String text = reply.path("message").asText("");
        if (!ReplyStatus.isOk(status)) {
            return new BroadcastEvent(topic, status, text, null);
        }
        EventBatch batch;
        try {
            batch = eventBatchCodec.read(reply.path("parameters"));
        } catch (IllegalArgumentException e) {
            throw new BroadcastParseException("broadcast for " + topic + ": " + e.getMessage(), e);
        }
        return new BroadcastEvent(topic, status, text, batch);
    }
}
