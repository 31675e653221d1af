package com.plyoox.stream.notifier.exceptions;

import lombok.Getter;

import javax.annotation.Nonnull;

/**
 * Request to the platform could not be sent or no response was received.
 */
@Getter
public class TransportException extends NotifierException {
    private final String operation;

    public TransportException(String operation, Throwable cause) {
        super("Request failed before a response was received: " + operation, cause);
        this.operation = operation;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.TRANSPORT;
    }
}
