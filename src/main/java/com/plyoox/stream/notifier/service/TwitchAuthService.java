package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.twitch.TokenResponse;

import javax.annotation.Nonnull;

/**
 * Token endpoint of the Twitch identity service.
 */
public interface TwitchAuthService {

    @Nonnull
    TokenResponse exchangeAppToken();

    @Nonnull
    TokenResponse exchangeUserCode(@Nonnull String code);

    /**
     * @return authorize URL a broadcaster opens to grant the {@code user:read:email} scope
     */
    @Nonnull
    String buildLoginUrl(@Nonnull String state);
}
