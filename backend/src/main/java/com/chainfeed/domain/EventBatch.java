package com.chainfeed.domain;

import java.util.List;
import java.util.OptionalLong;

/**
 * Page of transactions and logs with the batch timestamp reported by the source.
 */
public record EventBatch(List<Transaction> transactions, List<EventLog> logs, long batchTimestamp) {

    public EventBatch {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static EventBatch empty(long batchTimestamp) {
        return new EventBatch(List.of(), List.of(), batchTimestamp);
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    /**
     * Highest transaction block timestamp in the batch, empty when there are no transactions.
     */
    public OptionalLong maxBlockTimestamp() {
        return transactions.stream().mapToLong(Transaction::getBlockTimestamp).max();
    }
}
