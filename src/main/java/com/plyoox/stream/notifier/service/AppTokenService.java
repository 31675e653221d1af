package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.AccessToken;

import javax.annotation.Nonnull;

/**
 * Holds the app access token used by every app-authenticated Twitch call.
 */
public interface AppTokenService {

    /**
     * @return cached token while it is not expired (minus skew), otherwise a freshly exchanged one
     */
    @Nonnull
    AccessToken getValidToken();

    /**
     * Exchanges client credentials for a new token and replaces the cached one.
     */
    @Nonnull
    AccessToken refresh();
}
