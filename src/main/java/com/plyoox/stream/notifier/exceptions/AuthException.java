package com.plyoox.stream.notifier.exceptions;

import lombok.Getter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

@Getter
public class AuthException extends NotifierException {
    private final String operation;
    private final int status;
    @Nullable
    private final String upstreamMessage;

    public AuthException(String operation, int status, @Nullable String upstreamMessage) {
        super(String.format("Twitch rejected credentials for %s with status %d: %s", operation, status, upstreamMessage));
        this.operation = operation;
        this.status = status;
        this.upstreamMessage = upstreamMessage;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.AUTH;
    }
}
