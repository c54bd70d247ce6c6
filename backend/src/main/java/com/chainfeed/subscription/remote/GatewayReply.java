package com.chainfeed.subscription.remote;

import com.chainfeed.domain.ReplyStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Gateway reply envelope: {@code {"status", "message", "parameters"}}.
 */
public record GatewayReply(String status, String message, JsonNode parameters) {

    public GatewayReply {
        message = message == null ? "" : message;
        parameters = parameters == null ? MissingNode.getInstance() : parameters;
    }

    public static GatewayReply ok() {
        return new GatewayReply(ReplyStatus.OK, "", null);
    }

    public static GatewayReply fail(String message) {
        return new GatewayReply(ReplyStatus.FAIL, message, null);
    }

    public boolean isOk() {
        return ReplyStatus.isOk(status);
    }
}
