package com.plyoox.stream.notifier.controllers;

import com.google.common.collect.ImmutableList;
import com.plyoox.stream.notifier.BaseTest;
import com.plyoox.stream.notifier.model.Broadcaster;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.utils.EventSubSignatures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_ID;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_SIGNATURE;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_TIMESTAMP;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_TYPE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class EventSubControllerTest extends BaseTest {
    private static final String MESSAGE = "e76c6bd4-55c9-4987-8304-da1588d8988b";
    private static final String TIMESTAMP = "2023-07-19T10:11:12.634234626Z";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldRefuseToStartWithBlankSecret() {
        assertThrows(IllegalArgumentException.class, () -> new EventSubController(null, null, ""));
    }

    @Test
    public void shouldAnswerChallengeWithRawValue() throws Exception {
        String body = "{\"challenge\":\"abc\",\"subscription\":{\"id\":\"es1\",\"type\":\"stream.online\",\"version\":\"1\"}}";

        sendSigned("webhook_callback_verification", body)
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("abc"));
    }

    @Test
    public void shouldRejectInvalidSignatureBeforeParsing() throws Exception {
        mockMvc.perform(post("/_notify/twitch")
                        .header(MESSAGE_ID, MESSAGE)
                        .header(MESSAGE_TIMESTAMP, TIMESTAMP)
                        .header(MESSAGE_TYPE, "notification")
                        .header(MESSAGE_SIGNATURE, "sha256=" + "00".repeat(32))
                        .content("this is not json")
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(twitchHelixClient, botNotificationClient);
    }

    @Test
    public void shouldRejectMissingHeaders() throws Exception {
        mockMvc.perform(post("/_notify/twitch")
                        .header(MESSAGE_ID, MESSAGE)
                        .header(MESSAGE_TYPE, "notification")
                        .content("{}")
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void shouldRejectMalformedSignedBody() throws Exception {
        sendSigned("notification", "{\"event\":")
                .andExpect(status().isBadRequest());
    }

    @Test
    public void shouldIgnoreUnknownMessageType() throws Exception {
        sendSigned("something_new", "{}")
                .andExpect(status().isOk())
                .andExpect(content().string(""));
    }

    @Test
    public void shouldForwardStreamOnlineToBot() throws Exception {
        StreamData stream = StreamData.builder()
                .id("40078987165")
                .userId("555")
                .userLogin("streamer")
                .userName("Streamer")
                .gameName("Just Chatting")
                .title("hello")
                .viewerCount(7)
                .startedAt("2023-07-19T10:11:00Z")
                .thumbnailUrl("https://static-cdn.jtvnw.net/previews-ttv/live_user_streamer-{width}x{height}.jpg")
                .build();
        when(twitchHelixClient.getStreams(any(), any(), eq(555L))).thenReturn(ResponseEntity.ok(TwitchDataResponse.of(ImmutableList.of(stream))));
        String body = "{\"subscription\":{\"id\":\"es1\",\"type\":\"stream.online\",\"version\":\"1\","
                + "\"condition\":{\"broadcaster_user_id\":\"555\"}},"
                + "\"event\":{\"id\":\"9001\",\"broadcaster_user_id\":\"555\",\"broadcaster_user_login\":\"streamer\","
                + "\"broadcaster_user_name\":\"Streamer\",\"type\":\"live\",\"started_at\":\"2023-07-19T10:11:00Z\"}}";

        sendSigned("notification", body)
                .andExpect(status().isOk());

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                verify(botNotificationClient).notifyStreamOnline(argThat((Map<String, ?> params) ->
                        "40078987165".equals(params.get("stream_id"))
                                && "streamer".equals(params.get("user_login"))
                                && "Just Chatting".equals(params.get("game_name"))
                                && Integer.valueOf(7).equals(params.get("viewer_count")))));
    }

    @Test
    public void shouldAnswerOkWhenStreamLookupFails() throws Exception {
        when(twitchHelixClient.getStreams(any(), any(), anyLong())).thenReturn(ResponseEntity.ok(new TwitchDataResponse<>()));
        String body = "{\"subscription\":{\"id\":\"es1\"},\"event\":{\"broadcaster_user_id\":\"555\",\"broadcaster_user_login\":\"streamer\"}}";

        sendSigned("notification", body)
                .andExpect(status().isOk());

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> verify(twitchHelixClient).getStreams(any(), any(), eq(555L)));
        verify(botNotificationClient, never()).notifyStreamOnline(any());
    }

    @Test
    public void shouldCascadeRevocation() throws Exception {
        broadcasterDao.upsert(Broadcaster.builder().id(555L).displayName("Streamer").avatarUrl("a").eventSubscriptionId("es1").build());
        registrationDao.insert(123L, 555L);
        registrationDao.insert(456L, 555L);
        String body = "{\"subscription\":{\"id\":\"es1\",\"status\":\"authorization_revoked\",\"type\":\"stream.online\","
                + "\"condition\":{\"broadcaster_user_id\":\"555\"}}}";

        sendSigned("revocation", body)
                .andExpect(status().isOk());

        assertFalse(broadcasterDao.findById(555L).isPresent());
        assertEquals(0, registrationDao.countByBroadcaster(555L));
        assertThat(registrationDao.findByGuild(123L)).isEmpty();
        verify(twitchHelixClient, never()).deleteSubscription(any(), any(), any());
    }

    private ResultActions sendSigned(String type, String body) throws Exception {
        byte[] rawBody = body.getBytes(StandardCharsets.UTF_8);
        return mockMvc.perform(post("/_notify/twitch")
                .header(MESSAGE_ID, MESSAGE)
                .header(MESSAGE_TIMESTAMP, TIMESTAMP)
                .header(MESSAGE_TYPE, type)
                .header(MESSAGE_SIGNATURE, EventSubSignatures.signatureHeader(MESSAGE, TIMESTAMP, rawBody, EVENTSUB_SECRET))
                .content(rawBody)
                .contentType(MediaType.APPLICATION_JSON));
    }
}
