package com.plyoox.stream.notifier.restClients;

import com.plyoox.stream.notifier.model.twitch.CreateEventSubRequest;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(name = "twitch-helix", url = "${twitch.helix.url}")
public interface TwitchHelixClient {
    String AUTHORIZATION = "Authorization";
    String CLIENT_ID = "Client-Id";

    @GetMapping("/users")
    ResponseEntity<TwitchDataResponse<TwitchUser>> getUsers(@RequestHeader(AUTHORIZATION) String authorization,
                                                            @RequestHeader(CLIENT_ID) String clientId);

    @PostMapping("/eventsub/subscriptions")
    ResponseEntity<TwitchDataResponse<EventSubSubscription>> createSubscription(@RequestHeader(AUTHORIZATION) String authorization,
                                                                                @RequestHeader(CLIENT_ID) String clientId,
                                                                                @RequestBody CreateEventSubRequest request);

    @GetMapping("/eventsub/subscriptions")
    ResponseEntity<TwitchDataResponse<EventSubSubscription>> getSubscriptionsByUser(@RequestHeader(AUTHORIZATION) String authorization,
                                                                                    @RequestHeader(CLIENT_ID) String clientId,
                                                                                    @RequestParam("user_id") long userId);

    @GetMapping("/eventsub/subscriptions")
    ResponseEntity<TwitchDataResponse<EventSubSubscription>> getSubscriptions(@RequestHeader(AUTHORIZATION) String authorization,
                                                                              @RequestHeader(CLIENT_ID) String clientId,
                                                                              @RequestParam("type") String type,
                                                                              @RequestParam(value = "after", required = false) String after);

    @DeleteMapping("/eventsub/subscriptions")
    ResponseEntity<Void> deleteSubscription(@RequestHeader(AUTHORIZATION) String authorization,
                                            @RequestHeader(CLIENT_ID) String clientId,
                                            @RequestParam("id") String id);

    @GetMapping("/streams")
    ResponseEntity<TwitchDataResponse<StreamData>> getStreams(@RequestHeader(AUTHORIZATION) String authorization,
                                                              @RequestHeader(CLIENT_ID) String clientId,
                                                              @RequestParam("user_id") long userId);
}
