package com.plyoox.stream.notifier.exceptions;

import javax.annotation.Nonnull;

public class ValidationException extends NotifierException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.VALIDATION;
    }
}
