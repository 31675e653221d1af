package com.plyoox.stream.notifier.exceptions;

import javax.annotation.Nonnull;

/**
 * Invariant violation, e.g. a conflict reported by the platform with no subscription to be found.
 */
public class InternalException extends NotifierException {

    public InternalException(String message) {
        super(message);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.INTERNAL;
    }
}
