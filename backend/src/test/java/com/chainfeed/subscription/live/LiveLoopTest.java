package com.chainfeed.subscription.live;

import com.chainfeed.common.CancellationToken;
import com.chainfeed.common.OutputChannel;
import com.chainfeed.domain.BroadcastEvent;
import com.chainfeed.subscription.codec.EventBatchCodec;
import com.chainfeed.subscription.transport.BroadcastParser;
import com.chainfeed.subscription.transport.TransportException;
import com.chainfeed.support.FakeBroadcastTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LiveLoopTest {

    private static final String OK_BROADCAST = """
            {"topic": "1.0xaaa", "reply": {"status": "OK", "message": "",
             "parameters": {"block_timestamp": 500, "transactions": [{"network_id": "1", "address": "0xaaa", "block_timestamp": 450}]}}}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BroadcastParser parser = new BroadcastParser(objectMapper, new EventBatchCodec(objectMapper));
    private final FakeBroadcastTransport transport = new FakeBroadcastTransport();
    private final OutputChannel<BroadcastEvent> events = new OutputChannel<>();
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicInteger exits = new AtomicInteger();

    private LiveLoop loop() {
        return new LiveLoop(transport, parser, events, "0xreader", Duration.ofMillis(20), Duration.ofMillis(5),
                cancellation, exits::incrementAndGet);
    }

    @Test
    void forwardsBroadcastsUntilTransportCloses() {
        transport.push("s", OK_BROADCAST);
        transport.push("s", OK_BROADCAST);
        new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            transport.close();
        }).start();

        loop().run();

        List<BroadcastEvent> received = events.drain();
        assertThat(received).hasSize(2).allSatisfy(e -> {
            assertThat(e.isOk()).isTrue();
            assertThat(e.payload().maxBlockTimestamp()).hasValue(450L);
        });
        assertThat(exits.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("unparseable broadcast publishes one failure for the identity and ends the loop")
    void parseFailure_publishesFailureAndExits() {
        transport.push("s", "definitely not json");
        transport.push("s", OK_BROADCAST);

        loop().run();

        assertThat(events.drain()).singleElement().satisfies(e -> {
            assertThat(e.isOk()).isFalse();
            assertThat(e.topic()).isEqualTo("0xreader");
            assertThat(e.message()).startsWith("Error when parsing message ");
        });
        assertThat(transport.isClosed()).isTrue();
        assertThat(exits.get()).isEqualTo(1);
    }

    @Test
    void nullTransactionInBroadcast_publishesFailureAndExits() {
        transport.push("s", "{\"topic\": \"1.0xaaa\", \"reply\": {\"status\": \"OK\", \"parameters\": {\"transactions\": [null]}}}");
        transport.push("s", OK_BROADCAST);

        loop().run();

        assertThat(events.drain()).singleElement().satisfies(e -> {
            assertThat(e.isOk()).isFalse();
            assertThat(e.topic()).isEqualTo("0xreader");
            assertThat(e.message()).contains("transactions[0]");
        });
        assertThat(transport.isClosed()).isTrue();
        assertThat(exits.get()).isEqualTo(1);
    }

    @Test
    void failedBroadcast_forwardedThenExits() {
        transport.push("s", OK_BROADCAST);
        transport.push("s", "{\"topic\": \"1.0xaaa\", \"reply\": {\"status\": \"fail\", \"message\": \"indexer lost\"}}");
        transport.push("s", OK_BROADCAST);

        loop().run();

        List<BroadcastEvent> received = events.drain();
        assertThat(received).hasSize(2);
        assertThat(received.get(1).isOk()).isFalse();
        assertThat(received.get(1).message()).isEqualTo("indexer lost");
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void receiveError_pausesAndContinues() {
        transport.pushError(new TransportException("slow consumer"));
        transport.push("s", OK_BROADCAST);
        transport.push("s", "{\"topic\": \"1.0xaaa\", \"reply\": {\"status\": \"fail\", \"message\": \"stop\"}}");

        loop().run();

        assertThat(events.drain()).hasSize(2);
        assertThat(exits.get()).isEqualTo(1);
    }

    @Test
    void cancelled_exitsAndClosesTransport() {
        cancellation.cancel();
        transport.push("s", OK_BROADCAST);

        loop().run();

        assertThat(events.size()).isZero();
        assertThat(transport.isClosed()).isTrue();
        assertThat(exits.get()).isEqualTo(1);
    }
}
