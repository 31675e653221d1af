package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.StreamOnlineNotification;

import javax.annotation.Nonnull;

/**
 * Best-effort hand-off of stream.online notifications to the bot. Nothing is retried.
 */
public interface StreamNotificationDelivery {

    /**
     * Looks the live stream up and sends it to the bot in the background. Never throws.
     */
    void notifyStreamOnlineAsync(long broadcasterId);

    void deliver(@Nonnull StreamOnlineNotification notification);
}
