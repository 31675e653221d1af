package com.plyoox.stream.notifier.exceptions;

import lombok.Getter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Platform answered with a status the operation does not accept.
 */
@Getter
public class RemoteApiException extends NotifierException {
    public static final int NO_STATUS = -1;

    private final String operation;
    private final int status;
    @Nullable
    private final String upstreamMessage;

    public RemoteApiException(String operation, int status, @Nullable String upstreamMessage) {
        super(String.format("Twitch %s failed with status %d: %s", operation, status, upstreamMessage));
        this.operation = operation;
        this.status = status;
        this.upstreamMessage = upstreamMessage;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.REMOTE_API;
    }
}
