package com.plyoox.stream.notifier.exceptions;

import javax.annotation.Nonnull;

public class ConcurrencyException extends NotifierException {

    public ConcurrencyException(String message) {
        super(message);
    }

    public ConcurrencyException(String message, Throwable cause) {
        super(message, cause);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.CONCURRENCY;
    }
}
