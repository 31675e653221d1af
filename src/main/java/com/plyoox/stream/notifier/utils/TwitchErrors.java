package com.plyoox.stream.notifier.utils;

import com.plyoox.stream.notifier.exceptions.NotifierException;
import com.plyoox.stream.notifier.exceptions.RemoteApiException;
import com.plyoox.stream.notifier.exceptions.TransportException;
import com.plyoox.stream.notifier.model.twitch.TwitchErrorResponse;
import feign.FeignException;
import feign.RetryableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;

import static com.plyoox.stream.notifier.conf.CommonConfig.DEFAULT_OBJECT_MAPPER;

/**
 * Translation of Feign failures into the service's exception hierarchy.
 */
@Slf4j
public final class TwitchErrors {
    private static final int MAX_RAW_MESSAGE_LENGTH = 256;

    private TwitchErrors() {
    }

    public static boolean isTransportFailure(@Nonnull FeignException e) {
        return e instanceof RetryableException || e.status() < 0;
    }

    /**
     * @return {@code message} of the Helix error body, or the raw body abbreviated when it is not JSON
     */
    @Nullable
    public static String upstreamMessage(@Nonnull FeignException e) {
        String content = e.contentUTF8();
        if (StringUtils.isBlank(content)) {
            return null;
        }
        try {
            TwitchErrorResponse error = DEFAULT_OBJECT_MAPPER.readValue(content, TwitchErrorResponse.class);
            if (error != null && StringUtils.isNotBlank(error.getMessage())) {
                return error.getMessage();
            }
        } catch (IOException e1) {
            log.debug("upstreamMessage(): error body is not Helix JSON: {}", e1.getMessage());
        }
        return StringUtils.abbreviate(content, MAX_RAW_MESSAGE_LENGTH);
    }

    @Nonnull
    public static NotifierException translate(@Nonnull String operation, @Nonnull FeignException e) {
        if (isTransportFailure(e)) {
            log.error("{}(): request to Twitch failed: {}", operation, e.getMessage());
            return new TransportException(operation, e);
        }
        String upstreamMessage = upstreamMessage(e);
        log.error("{}(): Twitch answered with status {}: {}", operation, e.status(), upstreamMessage);
        return new RemoteApiException(operation, e.status(), upstreamMessage);
    }

    /**
     * Fails with {@link RemoteApiException} unless the response carries exactly {@code expectedStatus}.
     */
    public static void expectStatus(@Nonnull String operation, @Nonnull ResponseEntity<?> response, int expectedStatus) {
        int status = response.getStatusCodeValue();
        if (status != expectedStatus) {
            log.error("{}(): Twitch answered with unexpected status {}, expected {}", operation, status, expectedStatus);
            throw new RemoteApiException(operation, status, "Unexpected status " + status);
        }
    }
}
