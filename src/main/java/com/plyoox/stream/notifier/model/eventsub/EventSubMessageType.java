package com.plyoox.stream.notifier.model.eventsub;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values of the {@code Twitch-Eventsub-Message-Type} header.
 */
public enum EventSubMessageType {
    WEBHOOK_CALLBACK_VERIFICATION("webhook_callback_verification"),
    NOTIFICATION("notification"),
    REVOCATION("revocation");

    private final String code;

    EventSubMessageType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<EventSubMessageType> byCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
