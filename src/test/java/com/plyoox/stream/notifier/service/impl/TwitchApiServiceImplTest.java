package com.plyoox.stream.notifier.service.impl;

import com.google.common.collect.ImmutableList;
import com.plyoox.stream.notifier.exceptions.AuthException;
import com.plyoox.stream.notifier.exceptions.RemoteApiException;
import com.plyoox.stream.notifier.exceptions.SubscriptionConflictException;
import com.plyoox.stream.notifier.exceptions.TransportException;
import com.plyoox.stream.notifier.model.AccessToken;
import com.plyoox.stream.notifier.model.twitch.CreateEventSubRequest;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.model.twitch.Pagination;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;
import com.plyoox.stream.notifier.restClients.TwitchHelixClient;
import com.plyoox.stream.notifier.service.AppTokenService;
import feign.FeignException;
import feign.Request;
import feign.Response;
import feign.RetryableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TwitchApiServiceImplTest {
    private static final String CLIENT_ID = "client";
    private static final String CALLBACK = "https://notifier.example.com/_notify/twitch";
    private static final String SECRET = "eventsub-secret";

    @Mock
    private TwitchHelixClient helixClient;
    @Mock
    private AppTokenService appTokenService;
    @Captor
    private ArgumentCaptor<CreateEventSubRequest> requestCaptor;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private TwitchApiServiceImpl twitchApiService;

    @BeforeEach
    void setUp() {
        lenient().when(appTokenService.getValidToken()).thenReturn(new AccessToken("app", Long.MAX_VALUE));
        twitchApiService = new TwitchApiServiceImpl(helixClient, appTokenService, meterRegistry, CLIENT_ID, CALLBACK, SECRET);
    }

    @Test
    void shouldRefuseToStartWithoutEventSubSecret() {
        assertThrows(IllegalArgumentException.class,
                () -> new TwitchApiServiceImpl(helixClient, appTokenService, meterRegistry, CLIENT_ID, CALLBACK, ""));
    }

    @Test
    void shouldFetchUserWithUserToken() {
        TwitchUser user = TwitchUser.builder().id(555L).login("streamer").displayName("Streamer").build();
        when(helixClient.getUsers("Bearer user", CLIENT_ID)).thenReturn(ResponseEntity.ok(TwitchDataResponse.of(ImmutableList.of(user))));

        assertEquals(555L, twitchApiService.fetchUser("user").getId());
        verifyNoInteractions(appTokenService);
    }

    @Test
    void shouldTranslateRejectedUserToken() {
        when(helixClient.getUsers(any(), any())).thenThrow(feignError(401, "{\"error\":\"Unauthorized\",\"status\":401,\"message\":\"Invalid OAuth token\"}"));

        AuthException e = assertThrows(AuthException.class, () -> twitchApiService.fetchUser("user"));
        assertEquals(401, e.getStatus());
        assertEquals("Invalid OAuth token", e.getUpstreamMessage());
    }

    @Test
    void shouldFailWhenNoUserReturned() {
        when(helixClient.getUsers(any(), any())).thenReturn(ResponseEntity.ok(new TwitchDataResponse<>()));

        assertThrows(RemoteApiException.class, () -> twitchApiService.fetchUser("user"));
    }

    @Test
    void shouldCreateStreamOnlineWebhookSubscription() {
        when(helixClient.createSubscription(eq("Bearer app"), eq(CLIENT_ID), requestCaptor.capture()))
                .thenReturn(ResponseEntity.status(HttpStatus.ACCEPTED).body(TwitchDataResponse.of(ImmutableList.of(
                        EventSubSubscription.builder().id("es1").type(EventSubSubscription.STREAM_ONLINE).build()))));

        assertEquals("es1", twitchApiService.createSubscription(555L));

        CreateEventSubRequest request = requestCaptor.getValue();
        assertEquals("stream.online", request.getType());
        assertEquals("1", request.getVersion());
        assertEquals("555", request.getCondition().getBroadcasterUserId());
        assertEquals("webhook", request.getTransport().getMethod());
        assertEquals(CALLBACK, request.getTransport().getCallback());
        assertEquals(SECRET, request.getTransport().getSecret());
    }

    @Test
    void shouldRejectUnexpectedSuccessStatusOnCreate() {
        when(helixClient.createSubscription(any(), any(), any()))
                .thenReturn(ResponseEntity.ok(TwitchDataResponse.of(ImmutableList.of(EventSubSubscription.builder().id("es1").build()))));

        RemoteApiException e = assertThrows(RemoteApiException.class, () -> twitchApiService.createSubscription(555L));
        assertEquals(200, e.getStatus());
    }

    @Test
    void shouldReportConflictOnCreate() {
        when(helixClient.createSubscription(any(), any(), any())).thenThrow(feignError(409, "{\"message\":\"subscription already exists\"}"));

        SubscriptionConflictException e = assertThrows(SubscriptionConflictException.class, () -> twitchApiService.createSubscription(555L));
        assertEquals(555L, e.getBroadcasterId());
        assertEquals(409, e.getStatus());
    }

    @Test
    void shouldTranslateServerErrorWithUpstreamMessage() {
        when(helixClient.createSubscription(any(), any(), any())).thenThrow(feignError(500, "{\"message\":\"internal\"}"));

        RemoteApiException e = assertThrows(RemoteApiException.class, () -> twitchApiService.createSubscription(555L));
        assertEquals(500, e.getStatus());
        assertEquals("internal", e.getUpstreamMessage());
        assertEquals(1.0, meterRegistry.counter("stream.notifier.twitch.api.error", "operation", "createSubscription", "status", "500").count());
    }

    @Test
    void shouldTranslateNetworkFailure() {
        when(helixClient.getStreams(any(), any(), eq(555L))).thenThrow(networkError());

        assertThrows(TransportException.class, () -> twitchApiService.fetchLiveStream(555L));
    }

    @Test
    void shouldTreatMissingSubscriptionAsDeleted() {
        when(helixClient.deleteSubscription("Bearer app", CLIENT_ID, "es1")).thenThrow(feignError(404, ""));

        twitchApiService.deleteSubscription("es1");
    }

    @Test
    void shouldDeleteSubscription() {
        when(helixClient.deleteSubscription("Bearer app", CLIENT_ID, "es1")).thenReturn(ResponseEntity.noContent().build());

        twitchApiService.deleteSubscription("es1");

        verify(helixClient).deleteSubscription("Bearer app", CLIENT_ID, "es1");
    }

    @Test
    void shouldFailDeleteOnServerError() {
        when(helixClient.deleteSubscription(any(), any(), any())).thenThrow(feignError(503, "oops"));

        RemoteApiException e = assertThrows(RemoteApiException.class, () -> twitchApiService.deleteSubscription("es1"));
        assertEquals("oops", e.getUpstreamMessage());
    }

    @Test
    void shouldFindOnlyStreamOnlineSubscriptionOfUser() {
        when(helixClient.getSubscriptionsByUser("Bearer app", CLIENT_ID, 555L)).thenReturn(ResponseEntity.ok(TwitchDataResponse.of(ImmutableList.of(
                EventSubSubscription.builder().id("other").type("channel.update").build(),
                EventSubSubscription.builder().id("es1").type(EventSubSubscription.STREAM_ONLINE).build()))));

        Optional<EventSubSubscription> found = twitchApiService.findSubscriptionByUser(555L);

        assertThat(found).map(EventSubSubscription::getId).contains("es1");
    }

    @Test
    void shouldListSubscriptionsPage() {
        TwitchDataResponse<EventSubSubscription> page = new TwitchDataResponse<>(
                ImmutableList.of(EventSubSubscription.builder().id("es1").build()), new Pagination("next"));
        when(helixClient.getSubscriptions(eq("Bearer app"), eq(CLIENT_ID), eq("stream.online"), isNull())).thenReturn(ResponseEntity.ok(page));

        TwitchDataResponse<EventSubSubscription> result = twitchApiService.listSubscriptions(null);

        assertThat(result.getData()).hasSize(1);
        assertThat(result.nextCursor()).contains("next");
    }

    @Test
    void shouldFailWhenUserIsNotLive() {
        when(helixClient.getStreams(any(), any(), eq(555L))).thenReturn(ResponseEntity.ok(new TwitchDataResponse<>()));

        assertThrows(RemoteApiException.class, () -> twitchApiService.fetchLiveStream(555L));
    }

    @Test
    void shouldReturnLiveStream() {
        StreamData stream = StreamData.builder().id("1").userId("555").title("hi").build();
        when(helixClient.getStreams(any(), any(), eq(555L))).thenReturn(ResponseEntity.ok(TwitchDataResponse.of(ImmutableList.of(stream))));

        assertEquals("hi", twitchApiService.fetchLiveStream(555L).getTitle());
    }

    static Request request() {
        return Request.create(Request.HttpMethod.GET, "https://api.twitch.tv/helix", Collections.emptyMap(), null, StandardCharsets.UTF_8, null);
    }

    static FeignException feignError(int status, String body) {
        Response response = Response.builder()
                .status(status)
                .reason("error")
                .request(request())
                .headers(Collections.emptyMap())
                .body(body, StandardCharsets.UTF_8)
                .build();
        return FeignException.errorStatus("TwitchHelixClient#call", response);
    }

    static RetryableException networkError() {
        return new RetryableException(-1, "Connection refused", Request.HttpMethod.GET, new IOException("Connection refused"), null, request());
    }
}
