package com.plyoox.stream.notifier.exceptions;

import lombok.Getter;

import javax.annotation.Nonnull;

/**
 * Registration for the guild and broadcaster already exists.
 */
@Getter
public class ConflictException extends NotifierException {
    private final long guildId;
    private final long broadcasterId;

    public ConflictException(long guildId, long broadcasterId) {
        super("Notification for this guild and broadcaster already exists.");
        this.guildId = guildId;
        this.broadcasterId = broadcasterId;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.CONFLICT;
    }
}
