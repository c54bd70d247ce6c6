package com.chainfeed.subscription;

public enum SubscriberPhase {
    CREATED,
    BACKFILL,
    LIVE,
    STOPPED
}
