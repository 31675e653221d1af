package com.plyoox.stream.notifier.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

@Value
@Builder
public class Broadcaster {
    long id;
    @NonNull
    String displayName;
    @NonNull
    String avatarUrl;
    @With
    @Nullable
    String eventSubscriptionId;

    public boolean hasSubscription() {
        return StringUtils.isNotEmpty(eventSubscriptionId);
    }
}
