package com.plyoox.stream.notifier.controllers;

import com.plyoox.stream.notifier.service.TwitchAuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthController {
    private final TwitchAuthService twitchAuthService;

    @GetMapping(value = "/service/twitch/auth", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getLoginUrl(@RequestParam(value = "state", defaultValue = "") String state) {
        return twitchAuthService.buildLoginUrl(state);
    }
}
