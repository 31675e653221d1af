package com.plyoox.stream.notifier.service.impl;

import com.google.common.collect.ImmutableMap;
import com.google.common.net.UrlEscapers;
import com.plyoox.stream.notifier.exceptions.RemoteApiException;
import com.plyoox.stream.notifier.model.twitch.TokenResponse;
import com.plyoox.stream.notifier.restClients.TwitchAuthClient;
import com.plyoox.stream.notifier.service.TwitchAuthService;
import com.plyoox.stream.notifier.utils.TwitchErrors;
import feign.FeignException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Map;

import static com.plyoox.stream.notifier.model.Metrics.Counters.TWITCH_API_ERRORS;
import static com.plyoox.stream.notifier.model.Metrics.Tags.OPERATION;
import static com.plyoox.stream.notifier.model.Metrics.Tags.STATUS;

@Slf4j
@Service
public class TwitchAuthServiceImpl implements TwitchAuthService {
    static final String LOGIN_SCOPE = "user:read:email";

    private final TwitchAuthClient twitchAuthClient;
    private final MeterRegistry meterRegistry;
    private final String authUrl;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUrl;

    @Autowired
    public TwitchAuthServiceImpl(TwitchAuthClient twitchAuthClient,
                                 MeterRegistry meterRegistry,
                                 @Value("${twitch.auth.url}") String authUrl,
                                 @Value("${twitch.client-id}") String clientId,
                                 @Value("${twitch.client-secret}") String clientSecret,
                                 @Value("${twitch.redirect-url}") String redirectUrl) {
        this.twitchAuthClient = twitchAuthClient;
        this.meterRegistry = meterRegistry;
        this.authUrl = StringUtils.removeEnd(authUrl, "/");
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUrl = redirectUrl;
    }

    @Nonnull
    @Override
    public TokenResponse exchangeAppToken() {
        return exchange("exchangeAppToken", ImmutableMap.of(
                "client_id", clientId,
                "client_secret", clientSecret,
                "grant_type", "client_credentials"));
    }

    @Nonnull
    @Override
    public TokenResponse exchangeUserCode(@Nonnull String code) {
        return exchange("exchangeUserCode", ImmutableMap.of(
                "client_id", clientId,
                "client_secret", clientSecret,
                "code", code,
                "grant_type", "authorization_code",
                "redirect_uri", redirectUrl));
    }

    @Nonnull
    @Override
    public String buildLoginUrl(@Nonnull String state) {
        return authUrl + "/oauth2/authorize?response_type=code"
                + "&client_id=" + escape(clientId)
                + "&redirect_uri=" + escape(redirectUrl)
                + "&scope=" + LOGIN_SCOPE
                + "&state=" + escape(state);
    }

    private TokenResponse exchange(String operation, Map<String, ?> form) {
        ResponseEntity<TokenResponse> response;
        try {
            response = twitchAuthClient.exchangeToken(form);
        } catch (FeignException e) {
            meterRegistry.counter(TWITCH_API_ERRORS, Tags.of(OPERATION, operation, STATUS, String.valueOf(e.status()))).increment();
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 200);
        TokenResponse body = response.getBody();
        if (body == null || StringUtils.isEmpty(body.getAccessToken())) {
            log.error("{}(): token endpoint answered 200 without access token", operation);
            throw new RemoteApiException(operation, response.getStatusCodeValue(), "Empty token response");
        }
        return body;
    }

    private static String escape(String value) {
        return UrlEscapers.urlFormParameterEscaper().escape(value);
    }
}
