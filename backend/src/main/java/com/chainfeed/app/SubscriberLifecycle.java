package com.chainfeed.app;

import com.chainfeed.common.ChannelReader;
import com.chainfeed.config.AsyncConfig;
import com.chainfeed.domain.HealthSignal;
import com.chainfeed.subscription.Subscriber;
import com.chainfeed.subscription.SubscriberFactory;
import com.chainfeed.subscription.SubscriberPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Starts a subscriber for the configured identity once the application is ready and relays its output
 * channels as application events. Stops it on shutdown.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chainfeed.subscriber", name = "auto-start", havingValue = "true")
public class SubscriberLifecycle implements DisposableBean {

    private static final Duration RELAY_POLL = Duration.ofMillis(500);

    private final SubscriberFactory subscriberFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor relayExecutor;

    private volatile Subscriber subscriber;

    public SubscriberLifecycle(SubscriberFactory subscriberFactory,
                               ApplicationEventPublisher eventPublisher,
                               @Qualifier(AsyncConfig.LIVE_EXECUTOR) Executor relayExecutor) {
        this.subscriberFactory = subscriberFactory;
        this.eventPublisher = eventPublisher;
        this.relayExecutor = relayExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        Subscriber created = subscriberFactory.create();
        this.subscriber = created;
        String identity = created.getIdentity();
        relayExecutor.execute(() -> relay(created, created.events(),
                event -> eventPublisher.publishEvent(new BroadcastReceivedEvent(this, identity, event))));
        relayExecutor.execute(() -> relay(created, created.health(),
                signal -> onHealthSignal(identity, signal)));
        created.start();
        log.info("Auto-started subscriber {}", identity);
    }

    private void onHealthSignal(String identity, HealthSignal signal) {
        log.warn("Subscriber {} reported {}: {}", identity, signal.reason(), signal.message());
        eventPublisher.publishEvent(new SubscriberHealthEvent(identity, signal));
    }

    private <T> void relay(Subscriber source, ChannelReader<T> channel, Consumer<T> sink) {
        try {
            while (true) {
                T item = channel.poll(RELAY_POLL);
                if (item != null) {
                    deliver(source, sink, item);
                } else if (source.phase() == SubscriberPhase.STOPPED) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (T item : channel.drain()) {
            deliver(source, sink, item);
        }
        log.debug("Relay for subscriber {} finished", source.getIdentity());
    }

    private <T> void deliver(Subscriber source, Consumer<T> sink, T item) {
        try {
            sink.accept(item);
        } catch (RuntimeException e) {
            log.warn("Listener failed for subscriber {} item {}: {}", source.getIdentity(), item, e.getMessage(), e);
        }
    }

    Subscriber getSubscriber() {
        return subscriber;
    }

    @Override
    public void destroy() {
        Subscriber current = subscriber;
        if (current != null) {
            current.stop();
        }
    }
}
