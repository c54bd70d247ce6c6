package com.chainfeed.common;

import java.time.Duration;
import java.util.List;

/**
 * Consumer side of an {@link OutputChannel}.
 */
public interface ChannelReader<T> {

    /**
     * Blocks until an item is available.
     */
    T take() throws InterruptedException;

    /**
     * Waits up to the given timeout; null if nothing arrived.
     */
    T poll(Duration timeout) throws InterruptedException;

    /**
     * Removes and returns every item currently buffered.
     */
    List<T> drain();

    int size();
}
