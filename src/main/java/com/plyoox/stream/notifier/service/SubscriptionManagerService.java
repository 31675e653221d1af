package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.SubscriptionState;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;

import javax.annotation.Nonnull;

/**
 * Keeps one remote {@code stream.online} subscription per broadcaster while at least one guild is
 * registered for it. The number of registrations referencing a broadcaster is the reference count of
 * its subscription.
 */
public interface SubscriptionManagerService {

    /**
     * Registers the guild for notifications about the broadcaster who issued {@code code}.
     *
     * @return id of the new registration
     * @throws com.plyoox.stream.notifier.exceptions.ConflictException if the guild is already registered
     */
    long register(@Nonnull String code, long guildId);

    /**
     * Returns the broadcaster's subscription id, creating the remote subscription if there is none yet.
     * Must run under the broadcaster's lock inside a transaction.
     */
    @Nonnull
    String ensureSubscription(@Nonnull TwitchUser user);

    /**
     * @throws com.plyoox.stream.notifier.exceptions.ValidationException if the registration does not exist
     */
    void releaseRegistration(long registrationId);

    void releaseGuild(long guildId);

    /**
     * Twitch revoked the subscription: forget the broadcaster together with its registrations.
     */
    void revoke(long broadcasterId, @Nonnull String subscriptionId);

    @Nonnull
    SubscriptionState getState(long broadcasterId);
}
