package com.plyoox.stream.notifier.model.eventsub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RevocationPayload {
    EventSubSubscription subscription;
}
