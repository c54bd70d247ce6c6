package com.chainfeed.support;

import com.chainfeed.domain.EventBatch;
import com.chainfeed.domain.Transaction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

public final class Fixtures {

    private Fixtures() {
    }

    public static Transaction tx(String networkId, String address, long blockTimestamp) {
        return Transaction.builder()
                .networkId(networkId)
                .address(address)
                .blockNumber(blockTimestamp / 10)
                .blockTimestamp(blockTimestamp)
                .txid("0x" + Long.toHexString(blockTimestamp))
                .method("transfer")
                .build();
    }

    /** Batch with one transaction per timestamp. */
    public static EventBatch batch(String networkId, String address, long batchTimestamp, long... blockTimestamps) {
        List<Transaction> txs = new ArrayList<>();
        for (long ts : blockTimestamps) {
            txs.add(tx(networkId, address, ts));
        }
        return new EventBatch(txs, List.of(), batchTimestamp);
    }

    /** Polls the condition until it holds or the timeout passes. */
    public static boolean waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
