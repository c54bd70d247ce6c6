package com.chainfeed.common;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded many-producer queue. Producers never block; consumers see it through {@link ChannelReader}.
 */
public class OutputChannel<T> implements ChannelReader<T> {

    private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();

    public void publish(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        queue.add(item);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public List<T> drain() {
        List<T> items = new ArrayList<>();
        queue.drainTo(items);
        return items;
    }

    @Override
    public int size() {
        return queue.size();
    }
}
