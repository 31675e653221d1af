package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.eventsub.WebhookResult;

import javax.annotation.Nonnull;

/**
 * Handles an EventSub delivery whose signature is already verified.
 */
public interface EventSubDispatcher {

    /**
     * @param messageType value of the {@code Twitch-Eventsub-Message-Type} header
     * @param rawBody     request body as received
     * @throws com.plyoox.stream.notifier.exceptions.ValidationException if the body is malformed
     */
    @Nonnull
    WebhookResult dispatch(@Nonnull String messageType, @Nonnull byte[] rawBody);
}
