package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Helix operations used by the notifier. App-scoped calls authenticate with the cached app token.
 */
public interface TwitchApiService {

    /**
     * @param userToken token obtained by exchanging the broadcaster's authorization code
     * @throws com.plyoox.stream.notifier.exceptions.AuthException if Twitch rejects the token
     */
    @Nonnull
    TwitchUser fetchUser(@Nonnull String userToken);

    /**
     * Creates a {@code stream.online} webhook subscription.
     *
     * @return id of the created subscription
     * @throws com.plyoox.stream.notifier.exceptions.SubscriptionConflictException if one already exists
     */
    @Nonnull
    String createSubscription(long broadcasterId);

    @Nonnull
    Optional<EventSubSubscription> findSubscriptionByUser(long broadcasterId);

    /**
     * One page of this application's {@code stream.online} subscriptions.
     */
    @Nonnull
    TwitchDataResponse<EventSubSubscription> listSubscriptions(@Nullable String cursor);

    /**
     * Succeeds when the subscription is deleted or does not exist anymore.
     */
    void deleteSubscription(@Nonnull String subscriptionId);

    /**
     * @throws com.plyoox.stream.notifier.exceptions.RemoteApiException if the user is not live
     */
    @Nonnull
    StreamData fetchLiveStream(long userId);
}
