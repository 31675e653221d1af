package com.plyoox.stream.notifier.model.eventsub;

public interface EventSubHeaders {
    String PREFIX = "Twitch-Eventsub-";

    String MESSAGE_ID = PREFIX + "Message-Id";
    String MESSAGE_SIGNATURE = PREFIX + "Message-Signature";
    String MESSAGE_TIMESTAMP = PREFIX + "Message-Timestamp";
    String MESSAGE_TYPE = PREFIX + "Message-Type";
}
