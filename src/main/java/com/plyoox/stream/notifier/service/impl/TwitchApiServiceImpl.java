package com.plyoox.stream.notifier.service.impl;

import com.plyoox.stream.notifier.exceptions.AuthException;
import com.plyoox.stream.notifier.exceptions.RemoteApiException;
import com.plyoox.stream.notifier.exceptions.SubscriptionConflictException;
import com.plyoox.stream.notifier.model.twitch.CreateEventSubRequest;
import com.plyoox.stream.notifier.model.twitch.EventSubCondition;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.model.twitch.EventSubTransport;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;
import com.plyoox.stream.notifier.restClients.TwitchHelixClient;
import com.plyoox.stream.notifier.service.AppTokenService;
import com.plyoox.stream.notifier.service.TwitchApiService;
import com.plyoox.stream.notifier.utils.EventSubSignatures;
import com.plyoox.stream.notifier.utils.TwitchErrors;
import feign.FeignException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;
import java.util.function.Function;

import static com.plyoox.stream.notifier.model.Metrics.Counters.TWITCH_API_ERRORS;
import static com.plyoox.stream.notifier.model.Metrics.Tags.OPERATION;
import static com.plyoox.stream.notifier.model.Metrics.Tags.STATUS;

@Slf4j
@Service
public class TwitchApiServiceImpl implements TwitchApiService {
    static final String SUBSCRIPTION_VERSION = "1";

    private final TwitchHelixClient helixClient;
    private final AppTokenService appTokenService;
    private final MeterRegistry meterRegistry;
    private final String clientId;
    private final String callbackUrl;
    private final String eventSubSecret;

    @Autowired
    public TwitchApiServiceImpl(TwitchHelixClient helixClient,
                                AppTokenService appTokenService,
                                MeterRegistry meterRegistry,
                                @Value("${twitch.client-id}") String clientId,
                                @Value("${twitch.eventsub.callback-url}") String callbackUrl,
                                @Value("${twitch.eventsub.secret}") String eventSubSecret) {
        this.helixClient = helixClient;
        this.appTokenService = appTokenService;
        this.meterRegistry = meterRegistry;
        this.clientId = clientId;
        this.callbackUrl = callbackUrl;
        this.eventSubSecret = EventSubSignatures.requireValidSecret(eventSubSecret);
    }

    @Nonnull
    @Override
    public TwitchUser fetchUser(@Nonnull String userToken) {
        String operation = "fetchUser";
        ResponseEntity<TwitchDataResponse<TwitchUser>> response;
        try {
            response = helixClient.getUsers(bearer(userToken), clientId);
        } catch (FeignException e) {
            countError(operation, e.status());
            if (e.status() == 400 || e.status() == 401) {
                String upstreamMessage = TwitchErrors.upstreamMessage(e);
                log.warn("fetchUser(): Twitch rejected user token with status {}: {}", e.status(), upstreamMessage);
                throw new AuthException(operation, e.status(), upstreamMessage);
            }
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 200);
        return firstRow(response).orElseThrow(() -> {
            log.error("fetchUser(): Twitch returned no user for the token");
            return new RemoteApiException(operation, response.getStatusCodeValue(), "No user returned");
        });
    }

    @Nonnull
    @Override
    public String createSubscription(long broadcasterId) {
        String operation = "createSubscription";
        CreateEventSubRequest request = CreateEventSubRequest.builder()
                .type(EventSubSubscription.STREAM_ONLINE)
                .version(SUBSCRIPTION_VERSION)
                .condition(new EventSubCondition(String.valueOf(broadcasterId)))
                .transport(EventSubTransport.builder()
                        .method(EventSubTransport.WEBHOOK)
                        .callback(callbackUrl)
                        .secret(eventSubSecret)
                        .build())
                .build();
        ResponseEntity<TwitchDataResponse<EventSubSubscription>> response;
        try {
            response = withAppToken(token -> helixClient.createSubscription(token, clientId, request));
        } catch (FeignException e) {
            countError(operation, e.status());
            if (e.status() == 409) {
                String upstreamMessage = TwitchErrors.upstreamMessage(e);
                log.warn("createSubscription(): subscription for broadcaster {} already exists: {}", broadcasterId, upstreamMessage);
                throw new SubscriptionConflictException(operation, broadcasterId, upstreamMessage);
            }
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 202);
        String subscriptionId = firstRow(response)
                .map(EventSubSubscription::getId)
                .orElseThrow(() -> {
                    log.error("createSubscription(): Twitch accepted subscription for {} without returning it", broadcasterId);
                    return new RemoteApiException(operation, response.getStatusCodeValue(), "No subscription returned");
                });
        log.info("createSubscription(): subscription {} created for broadcaster {}", subscriptionId, broadcasterId);
        return subscriptionId;
    }

    @Nonnull
    @Override
    public Optional<EventSubSubscription> findSubscriptionByUser(long broadcasterId) {
        String operation = "findSubscriptionByUser";
        ResponseEntity<TwitchDataResponse<EventSubSubscription>> response;
        try {
            response = withAppToken(token -> helixClient.getSubscriptionsByUser(token, clientId, broadcasterId));
        } catch (FeignException e) {
            countError(operation, e.status());
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 200);
        return Optional.ofNullable(response.getBody())
                .map(TwitchDataResponse::getData)
                .flatMap(subscriptions -> subscriptions.stream()
                        .filter(subscription -> EventSubSubscription.STREAM_ONLINE.equals(subscription.getType()))
                        .findFirst());
    }

    @Nonnull
    @Override
    public TwitchDataResponse<EventSubSubscription> listSubscriptions(@Nullable String cursor) {
        String operation = "listSubscriptions";
        ResponseEntity<TwitchDataResponse<EventSubSubscription>> response;
        try {
            response = withAppToken(token -> helixClient.getSubscriptions(token, clientId, EventSubSubscription.STREAM_ONLINE, cursor));
        } catch (FeignException e) {
            countError(operation, e.status());
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 200);
        TwitchDataResponse<EventSubSubscription> body = response.getBody();
        return body == null ? new TwitchDataResponse<>() : body;
    }

    @Override
    public void deleteSubscription(@Nonnull String subscriptionId) {
        String operation = "deleteSubscription";
        ResponseEntity<Void> response;
        try {
            response = withAppToken(token -> helixClient.deleteSubscription(token, clientId, subscriptionId));
        } catch (FeignException e) {
            if (e.status() == 404) {
                log.warn("deleteSubscription(): subscription {} does not exist anymore", subscriptionId);
                return;
            }
            countError(operation, e.status());
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 204);
        log.info("deleteSubscription(): subscription {} deleted", subscriptionId);
    }

    @Nonnull
    @Override
    public StreamData fetchLiveStream(long userId) {
        String operation = "fetchLiveStream";
        ResponseEntity<TwitchDataResponse<StreamData>> response;
        try {
            response = withAppToken(token -> helixClient.getStreams(token, clientId, userId));
        } catch (FeignException e) {
            countError(operation, e.status());
            throw TwitchErrors.translate(operation, e);
        }
        TwitchErrors.expectStatus(operation, response, 200);
        return firstRow(response).orElseThrow(() -> {
            log.warn("fetchLiveStream(): user {} is not live", userId);
            return new RemoteApiException(operation, response.getStatusCodeValue(), "User " + userId + " is not live");
        });
    }

    private <T> T withAppToken(Function<String, T> call) {
        return call.apply(bearer(appTokenService.getValidToken().getValue()));
    }

    private void countError(String operation, int status) {
        meterRegistry.counter(TWITCH_API_ERRORS, Tags.of(OPERATION, operation, STATUS, String.valueOf(status))).increment();
    }

    private static <T> Optional<T> firstRow(ResponseEntity<TwitchDataResponse<T>> response) {
        return Optional.ofNullable(response.getBody()).flatMap(TwitchDataResponse::first);
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
