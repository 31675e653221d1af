package com.plyoox.stream.notifier.model.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EventSubSubscription {
    public static final String STREAM_ONLINE = "stream.online";

    String id;
    String status;
    String type;
    String version;
    EventSubCondition condition;
    EventSubTransport transport;
    String createdAt;
    int cost;
}
