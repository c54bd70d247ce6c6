package com.chainfeed.subscription.codec;

import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.EventLog;
import com.chainfeed.domain.Transaction;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the {@code transactions}, {@code logs} and {@code block_timestamp} parameters shared by snapshot
 * replies and live broadcasts.
 */
@Component
public class EventBatchCodec {

    static final String TRANSACTIONS = "transactions";
    static final String LOGS = "logs";
    static final String BLOCK_TIMESTAMP = "block_timestamp";

    private final ObjectMapper objectMapper;
    private final JavaType transactionListType;
    private final JavaType logListType;

    public EventBatchCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.transactionListType = objectMapper.getTypeFactory().constructCollectionType(List.class, Transaction.class);
        this.logListType = objectMapper.getTypeFactory().constructCollectionType(List.class, EventLog.class);
    }

    /**
     * @throws IllegalArgumentException if {@code transactions} is missing, an element is not an object, or any field has the wrong shape
     */
    public EventBatch read(JsonNode parameters) {
        if (parameters == null || !parameters.isObject()) {
            throw new IllegalArgumentException("parameters must be an object");
        }
        JsonNode transactions = parameters.get(TRANSACTIONS);
        if (transactions == null || !transactions.isArray()) {
            throw new IllegalArgumentException("'" + TRANSACTIONS + "' must be an array");
        }
        JsonNode logs = parameters.path(LOGS);
        if (!logs.isMissingNode() && !logs.isNull() && !logs.isArray()) {
            throw new IllegalArgumentException("'" + LOGS + "' must be an array");
        }
        requireObjects(TRANSACTIONS, transactions);
        if (logs.isArray()) {
            requireObjects(LOGS, logs);
        }
        JsonNode timestamp = parameters.path(BLOCK_TIMESTAMP);
        if (!timestamp.isMissingNode() && !timestamp.isNumber()) {
            throw new IllegalArgumentException("'" + BLOCK_TIMESTAMP + "' must be a number");
        }
        List<Transaction> txs = objectMapper.convertValue(transactions, transactionListType);
        List<EventLog> eventLogs = logs.isArray() ? objectMapper.convertValue(logs, logListType) : List.of();
        return new EventBatch(txs, eventLogs, timestamp.asLong(0));
    }

    private static void requireObjects(String field, JsonNode array) {
        for (int i = 0; i < array.size(); i++) {
            if (!array.get(i).isObject()) {
                throw new IllegalArgumentException("'" + field + "[" + i + "]' must be an object");
            }
        }
    }
}
