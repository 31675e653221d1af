package com.plyoox.stream.notifier.exceptions;

import lombok.Getter;

import javax.annotation.Nonnull;

@Getter
public class PersistenceException extends NotifierException {
    private final String operation;

    public PersistenceException(String operation, Throwable cause) {
        super("Database operation failed: " + operation, cause);
        this.operation = operation;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.PERSISTENCE;
    }
}
