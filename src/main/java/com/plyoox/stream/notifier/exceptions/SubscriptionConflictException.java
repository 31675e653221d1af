package com.plyoox.stream.notifier.exceptions;

import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Platform already has a subscription for the broadcaster (HTTP 409 on create).
 */
@Getter
public class SubscriptionConflictException extends RemoteApiException {
    private final long broadcasterId;

    public SubscriptionConflictException(String operation, long broadcasterId, @Nullable String upstreamMessage) {
        super(operation, 409, upstreamMessage);
        this.broadcasterId = broadcasterId;
    }
}
