package com.plyoox.stream.notifier.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Registration {
    long id;
    long guildId;
    long broadcasterId;
}
