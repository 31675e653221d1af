package com.plyoox.stream.notifier.exceptions;

import javax.annotation.Nonnull;

/**
 * Root of every failure the service reports. Callers branch on {@link #getKind()} or on the
 * concrete subclass, never on the message text.
 */
public abstract class NotifierException extends RuntimeException {

    public enum Kind {
        TRANSPORT,
        REMOTE_API,
        AUTH,
        CONFLICT,
        PERSISTENCE,
        VALIDATION,
        CONCURRENCY,
        INTERNAL
    }

    protected NotifierException(String message) {
        super(message);
    }

    protected NotifierException(String message, Throwable cause) {
        super(message, cause);
    }

    @Nonnull
    public abstract Kind getKind();
}
