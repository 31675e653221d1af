package com.plyoox.stream.notifier.model.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamData {
    String id;
    String userId;
    String userLogin;
    String userName;
    String gameId;
    String gameName;
    @JsonProperty("type")
    String kind;
    String title;
    int viewerCount;
    String startedAt;
    String thumbnailUrl;
    String language;
    List<String> tags;
}
