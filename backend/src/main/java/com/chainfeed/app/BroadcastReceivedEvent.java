package com.chainfeed.app;

import com.chainfeed.domain.BroadcastEvent;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every event the auto-started subscriber emits, backfill and live alike.
 */
@Getter
public class BroadcastReceivedEvent extends ApplicationEvent {

    private final String identity;
    private final BroadcastEvent event;

    public BroadcastReceivedEvent(Object source, String identity, BroadcastEvent event) {
        super(source);
        this.identity = identity;
        this.event = event;
    }
}
