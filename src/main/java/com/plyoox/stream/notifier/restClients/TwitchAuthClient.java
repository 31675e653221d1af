package com.plyoox.stream.notifier.restClients;

import com.plyoox.stream.notifier.model.twitch.TokenResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;

import java.util.Map;

@FeignClient(name = "twitch-auth", url = "${twitch.auth.url}")
public interface TwitchAuthClient {

    @PostMapping(value = "/oauth2/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    ResponseEntity<TokenResponse> exchangeToken(Map<String, ?> form);
}
