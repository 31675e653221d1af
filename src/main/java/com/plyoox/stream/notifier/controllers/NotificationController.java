package com.plyoox.stream.notifier.controllers;

import com.plyoox.stream.notifier.exceptions.ValidationException;
import com.plyoox.stream.notifier.model.CreateNotificationRequest;
import com.plyoox.stream.notifier.service.SubscriptionManagerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/service/twitch/notifications")
@RequiredArgsConstructor
public class NotificationController {
    private final SubscriptionManagerService subscriptionManagerService;

    @PostMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public String createNotification(@RequestBody CreateNotificationRequest request) {
        if (request.getCode() == null || request.getCode().length() != CreateNotificationRequest.CODE_LENGTH) {
            throw new ValidationException("Invalid authorization code.");
        }
        if (request.getGuildId() == null) {
            throw new ValidationException("Guild id is missing.");
        }
        long registrationId = subscriptionManagerService.register(request.getCode(), request.getGuildId());
        return String.valueOf(registrationId);
    }

    @DeleteMapping("/{registrationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteNotification(@PathVariable long registrationId) {
        subscriptionManagerService.releaseRegistration(registrationId);
    }

    @DeleteMapping("/guild/{guildId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteGuild(@PathVariable long guildId) {
        log.info("deleteGuild(): removing notifications of guild {}", guildId);
        subscriptionManagerService.releaseGuild(guildId);
    }
}
