package com.plyoox.stream.notifier.service.impl;

import com.google.common.util.concurrent.MoreExecutors;
import com.plyoox.stream.notifier.exceptions.RemoteApiException;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.restClients.BotNotificationClient;
import com.plyoox.stream.notifier.service.TwitchApiService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamNotificationDeliveryImplTest {

    @Mock
    private TwitchApiService twitchApiService;
    @Mock
    private BotNotificationClient botNotificationClient;
    @Captor
    private ArgumentCaptor<Map<String, ?>> paramsCaptor;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private StreamNotificationDeliveryImpl delivery;

    @BeforeEach
    void setUp() {
        delivery = new StreamNotificationDeliveryImpl(twitchApiService, botNotificationClient,
                MoreExecutors.newDirectExecutorService(), meterRegistry);
    }

    @Test
    void shouldLookUpStreamAndNotifyBot() {
        when(twitchApiService.fetchLiveStream(555L)).thenReturn(StreamData.builder()
                .id("9001")
                .userId("555")
                .userLogin("streamer")
                .userName("Streamer")
                .gameName("Chess")
                .viewerCount(17)
                .startedAt("2023-11-14T22:13:20Z")
                .thumbnailUrl("https://cdn/{width}x{height}.jpg")
                .title("opening prep")
                .build());

        delivery.notifyStreamOnlineAsync(555L);

        verify(botNotificationClient).notifyStreamOnline(paramsCaptor.capture());
        Map<String, Object> params = new HashMap<>(paramsCaptor.getValue());
        assertThat(params).containsEntry("stream_id", "9001")
                .containsEntry("user_login", "streamer")
                .containsEntry("game_name", "Chess")
                .containsEntry("viewer_count", 17)
                .containsEntry("title", "opening prep");
        assertEquals(1.0, meterRegistry.counter("stream.notifier.delivery.ok").count());
    }

    @Test
    void shouldDropNotificationWhenStreamLookupFails() {
        when(twitchApiService.fetchLiveStream(555L)).thenThrow(new RemoteApiException("fetchLiveStream", 200, "User 555 is not live"));

        delivery.notifyStreamOnlineAsync(555L);

        verifyNoInteractions(botNotificationClient);
        assertEquals(1.0, meterRegistry.counter("stream.notifier.delivery.fail", "error_type", "stream_lookup").count());
    }

    @Test
    void shouldCountBotFailure() {
        when(twitchApiService.fetchLiveStream(555L)).thenReturn(StreamData.builder().id("9001").userId("555").build());
        doThrow(new IllegalStateException("bot is down")).when(botNotificationClient).notifyStreamOnline(anyMap());

        delivery.notifyStreamOnlineAsync(555L);

        assertEquals(1.0, meterRegistry.counter("stream.notifier.delivery.fail", "error_type", "bot").count());
        assertEquals(0.0, meterRegistry.counter("stream.notifier.delivery.ok").count());
    }

    @Test
    void shouldCountRejectedDelivery() {
        ExecutorService stopped = MoreExecutors.newDirectExecutorService();
        stopped.shutdown();
        delivery = new StreamNotificationDeliveryImpl(twitchApiService, botNotificationClient, stopped, meterRegistry);

        delivery.notifyStreamOnlineAsync(555L);

        verifyNoInteractions(twitchApiService, botNotificationClient);
        assertEquals(1.0, meterRegistry.counter("stream.notifier.delivery.fail", "error_type", "rejected").count());
    }

    @Test
    void shouldFillMissingFieldsWithEmptyValues() {
        when(twitchApiService.fetchLiveStream(555L)).thenReturn(StreamData.builder().id("9001").build());

        delivery.notifyStreamOnlineAsync(555L);

        verify(botNotificationClient).notifyStreamOnline(any());
        assertEquals(1.0, meterRegistry.counter("stream.notifier.delivery.ok").count());
    }
}
