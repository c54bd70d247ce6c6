package com.chainfeed.subscription.remote;

import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.Topic;
import com.chainfeed.domain.TopicFilter;
import com.chainfeed.domain.TopicKey;
import com.chainfeed.subscription.codec.EventBatchCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway client over HTTP using WebClient. Requests are {@code {"command", "parameters"}} JSON bodies
 * posted to a single endpoint; replies are {@link GatewayReply} envelopes.
 */
@Slf4j
public class WebClientGatewayClient implements GatewayClient {

    static final String RESOLVE_COMMAND = "smartcontract_filter";
    static final String SNAPSHOT_COMMAND = "snapshot_get";
    static final String HEARTBEAT_COMMAND = "heartbeat";

    private final WebClient webClient;
    private final String endpointUrl;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final EventBatchCodec eventBatchCodec;

    public WebClientGatewayClient(WebClient.Builder builder, String endpointUrl, Duration requestTimeout,
                                  ObjectMapper objectMapper, EventBatchCodec eventBatchCodec) {
        this.webClient = builder.build();
        this.endpointUrl = endpointUrl;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.eventBatchCodec = eventBatchCodec;
    }

    @Override
    public List<Topic> resolveTopics(TopicFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("topic_filter", filter != null ? filter : new TopicFilter());
        GatewayReply reply = requireOk(RESOLVE_COMMAND, call(RESOLVE_COMMAND, params));

        JsonNode smartcontracts = reply.parameters().path("smartcontracts");
        JsonNode topicStrings = reply.parameters().path("topics");
        if (!smartcontracts.isArray() || !topicStrings.isArray()) {
            throw new GatewayException(RESOLVE_COMMAND + ": reply must carry 'smartcontracts' and 'topics' arrays");
        }
        if (smartcontracts.size() != topicStrings.size()) {
            throw new GatewayException(RESOLVE_COMMAND + ": " + smartcontracts.size() + " smartcontracts but "
                    + topicStrings.size() + " topic strings");
        }
        List<Topic> topics = new ArrayList<>(smartcontracts.size());
        for (int i = 0; i < smartcontracts.size(); i++) {
            JsonNode sm = smartcontracts.get(i);
            TopicKey key;
            try {
                key = new TopicKey(sm.path("network_id").asText(null), sm.path("address").asText(null));
            } catch (IllegalArgumentException e) {
                throw new GatewayException(RESOLVE_COMMAND + ": smartcontract #" + i + " has no key", e);
            }
            topics.add(new Topic(key, topicStrings.get(i).asText(""), sm.path("pre_deploy_block_timestamp").asLong(0)));
        }
        return topics;
    }

    @Override
    public EventBatch fetchPage(SnapshotRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("smartcontract_key", request.key().value());
        params.put("block_timestamp_from", request.fromTimestamp());
        params.put("block_timestamp_to", request.toTimestamp());
        params.put("page", request.page());
        params.put("limit", request.pageSize());
        GatewayReply reply = requireOk(SNAPSHOT_COMMAND, call(SNAPSHOT_COMMAND, params));
        try {
            return eventBatchCodec.read(reply.parameters());
        } catch (IllegalArgumentException e) {
            throw new GatewayException(SNAPSHOT_COMMAND + ": malformed reply for " + request.key() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public GatewayReply probeLiveness() {
        return call(HEARTBEAT_COMMAND, Map.of());
    }

    private GatewayReply call(String command, Map<String, Object> parameters) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("command", command, "parameters", parameters));
        } catch (JsonProcessingException e) {
            throw new GatewayException(command + ": cannot encode request", e);
        }
        String raw;
        try {
            raw = webClient.post()
                    .uri(endpointUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(requestTimeout);
        } catch (WebClientResponseException e) {
            throw new GatewayException(command + ": HTTP " + e.getStatusCode().value() + " from " + endpointUrl, e);
        } catch (RuntimeException e) {
            throw new GatewayException(command + ": " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            throw new GatewayException(command + ": empty reply from " + endpointUrl);
        }
        return parseReply(command, raw);
    }

    private GatewayReply parseReply(String command, String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new GatewayException(command + ": reply is not JSON", e);
        }
        if (!root.isObject() || !root.path("status").isTextual()) {
            throw new GatewayException(command + ": reply has no status");
        }
        return new GatewayReply(root.get("status").asText(), root.path("message").asText(""), root.path("parameters"));
    }

    private static GatewayReply requireOk(String command, GatewayReply reply) {
        if (!reply.isOk()) {
            log.debug("Gateway {} replied {}: {}", command, reply.status(), reply.message());
            throw new GatewayException(command + " failed: " + reply.message());
        }
        return reply;
    }
}
