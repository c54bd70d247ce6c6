package com.chainfeed.subscription.transport;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NatsBroadcastTransportTest {

    @Mock
    Connection connection;
    @Mock
    Dispatcher dispatcher;

    private MessageHandler handler;
    private NatsBroadcastTransport transport;

    @BeforeEach
    void setUp() {
        ArgumentCaptor<MessageHandler> captor = ArgumentCaptor.forClass(MessageHandler.class);
        when(connection.createDispatcher(captor.capture())).thenReturn(dispatcher);
        when(connection.getStatus()).thenReturn(Connection.Status.CONNECTED);
        transport = new NatsBroadcastTransport(connection, "chainfeed.broadcast");
        handler = captor.getValue();
    }

    @Test
    void subscribe_prefixesSubjectAndFlushes() throws Exception {
        transport.subscribe("1.0xabc");

        verify(dispatcher).subscribe("chainfeed.broadcast.1.0xabc");
        verify(connection).flush(any(Duration.class));
    }

    @Test
    void subscribe_flushTimeout_throwsTransportException() throws Exception {
        doThrow(new TimeoutException("slow")).when(connection).flush(any(Duration.class));

        assertThatThrownBy(() -> transport.subscribe("1.0xabc"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("chainfeed.broadcast.1.0xabc");
    }

    @Test
    void receive_returnsMessagesBufferedSinceSubscribe() throws Exception {
        transport.subscribe("1.0xabc");
        Message msg = mock(Message.class);
        when(msg.getSubject()).thenReturn("chainfeed.broadcast.1.0xabc");
        when(msg.getData()).thenReturn("{\"topic\":\"1.0xabc\"}".getBytes(StandardCharsets.UTF_8));

        handler.onMessage(msg);
        TransportMessage received = transport.receive(Duration.ofMillis(100));

        assertThat(received.subject()).isEqualTo("chainfeed.broadcast.1.0xabc");
        assertThat(new String(received.data(), StandardCharsets.UTF_8)).contains("1.0xabc");
        assertThat(received.isTerminal()).isFalse();
    }

    @Test
    void receive_timeoutWhileConnected_returnsNull() {
        assertThat(transport.receive(Duration.ofMillis(20))).isNull();
    }

    @Test
    void receive_connectionClosed_returnsTerminal() {
        when(connection.getStatus()).thenReturn(Connection.Status.CLOSED);

        assertThat(transport.receive(Duration.ofMillis(20)).isTerminal()).isTrue();
    }

    @Test
    void close_isIdempotentAndEndsReceive() throws Exception {
        transport.close();
        transport.close();

        verify(connection, times(1)).close();
        assertThat(transport.receive(Duration.ofSeconds(5)).isTerminal()).isTrue();
        assertThatThrownBy(() -> transport.subscribe("1.0xabc")).isInstanceOf(TransportException.class);
    }
}
