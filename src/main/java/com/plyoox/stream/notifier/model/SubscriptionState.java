package com.plyoox.stream.notifier.model;

/**
 * Lifecycle of the remote event subscription for one broadcaster:
 * {@code ABSENT -> PENDING -> ACTIVE -> ABSENT}.
 */
public enum SubscriptionState {
    ABSENT,
    /**
     * Remote create request is in flight, nothing committed locally yet.
     */
    PENDING,
    ACTIVE
}
