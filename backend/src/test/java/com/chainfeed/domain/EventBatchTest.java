package com.chainfeed.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventBatchTest {

    @Test
    void maxBlockTimestamp_highestTransaction() {
        EventBatch batch = new EventBatch(List.of(
                Transaction.builder().blockTimestamp(30).build(),
                Transaction.builder().blockTimestamp(70).build(),
                Transaction.builder().blockTimestamp(50).build()), null, 100);

        assertThat(batch.isEmpty()).isFalse();
        assertThat(batch.logs()).isEmpty();
        assertThat(batch.maxBlockTimestamp()).hasValue(70);
    }

    @Test
    void empty_hasNoCheckpoint() {
        EventBatch batch = EventBatch.empty(100);
        assertThat(batch.isEmpty()).isTrue();
        assertThat(batch.maxBlockTimestamp()).isEmpty();
    }

    @Test
    void broadcastEvent_failCarriesNoPayload() {
        BroadcastEvent event = BroadcastEvent.fail("1.0xabc", "boom");
        assertThat(event.isOk()).isFalse();
        assertThat(event.status()).isEqualTo(ReplyStatus.FAIL);
        assertThat(event.payload()).isNull();
        assertThat(BroadcastEvent.ok("1.0xabc", EventBatch.empty(1)).isOk()).isTrue();
    }
}
