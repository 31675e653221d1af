package com.plyoox.stream.notifier.model;

import com.google.common.collect.ImmutableMap;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Flat message handed to the bot as GET query parameters.
 */
@Value
@Builder
public class StreamOnlineNotification {
    String streamId;
    String userId;
    String userLogin;
    String userName;
    String gameName;
    int viewerCount;
    String startedAt;
    String thumbnailUrl;
    String title;

    @Nonnull
    public static StreamOnlineNotification from(@Nonnull StreamData stream) {
        return StreamOnlineNotification.builder()
                .streamId(stream.getId())
                .userId(stream.getUserId())
                .userLogin(stream.getUserLogin())
                .userName(stream.getUserName())
                .gameName(stream.getGameName())
                .viewerCount(stream.getViewerCount())
                .startedAt(stream.getStartedAt())
                .thumbnailUrl(stream.getThumbnailUrl())
                .title(stream.getTitle())
                .build();
    }

    @Nonnull
    public Map<String, Object> toQueryParams() {
        return ImmutableMap.<String, Object>builder()
                .put("stream_id", StringUtils.defaultString(streamId))
                .put("user_id", StringUtils.defaultString(userId))
                .put("user_login", StringUtils.defaultString(userLogin))
                .put("user_name", StringUtils.defaultString(userName))
                .put("game_name", StringUtils.defaultString(gameName))
                .put("viewer_count", viewerCount)
                .put("started_at", StringUtils.defaultString(startedAt))
                .put("thumbnail_url", StringUtils.defaultString(thumbnailUrl))
                .put("title", StringUtils.defaultString(title))
                .build();
    }
}
