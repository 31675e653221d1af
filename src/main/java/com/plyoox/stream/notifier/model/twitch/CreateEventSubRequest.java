package com.plyoox.stream.notifier.model.twitch;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CreateEventSubRequest {
    String type;
    String version;
    EventSubCondition condition;
    EventSubTransport transport;
}
