package com.chainfeed.domain;

import java.util.Comparator;

/**
 * Key of one smart contract on one network. String form is {@code <networkId>.<address>}; it is both the
 * transport subscription filter and the progress store key.
 */
public record TopicKey(String networkId, String address) implements Comparable<TopicKey> {

    private static final Comparator<TopicKey> ORDER = Comparator
            .comparing(TopicKey::networkId)
            .thenComparing(TopicKey::address);

    public TopicKey {
        if (networkId == null || networkId.isBlank()) {
            throw new IllegalArgumentException("networkId is required");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
    }

    public static TopicKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("topic key is null");
        }
        int dot = value.indexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Malformed topic key: " + value);
        }
        return new TopicKey(value.substring(0, dot), value.substring(dot + 1));
    }

    public String value() {
        return networkId + "." + address;
    }

    @Override
    public int compareTo(TopicKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return value();
    }
}
