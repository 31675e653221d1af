package com.plyoox.stream.notifier.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotificationRequest {
    public static final int CODE_LENGTH = 28;

    @ToString.Exclude
    String code;
    @JsonAlias("guild_id")
    Long guildId;
}
