package com.chainfeed.subscription.transport;

/**
 * Raw broadcast as received. An empty payload is the transport's closed sentinel.
 */
public record TransportMessage(String subject, byte[] data) {

    private static final byte[] NO_DATA = new byte[0];

    public TransportMessage {
        data = data == null ? NO_DATA : data;
    }

    public static TransportMessage terminal() {
        return new TransportMessage("", NO_DATA);
    }

    public boolean isTerminal() {
        return data.length == 0;
    }
}
