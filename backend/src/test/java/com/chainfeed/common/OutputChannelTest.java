package com.chainfeed.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputChannelTest {

    @Test
    void publish_preservesOrder() throws Exception {
        OutputChannel<String> channel = new OutputChannel<>();
        channel.publish("a");
        channel.publish("b");

        assertThat(channel.size()).isEqualTo(2);
        assertThat(channel.take()).isEqualTo("a");
        assertThat(channel.poll(Duration.ofMillis(10))).isEqualTo("b");
        assertThat(channel.poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    void drain_returnsEverythingBuffered() {
        OutputChannel<Integer> channel = new OutputChannel<>();
        channel.publish(1);
        channel.publish(2);

        assertThat(channel.drain()).containsExactly(1, 2);
        assertThat(channel.size()).isZero();
    }

    @Test
    void publish_null_rejected() {
        OutputChannel<String> channel = new OutputChannel<>();
        assertThatThrownBy(() -> channel.publish(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
