package com.plyoox.stream.notifier.model.eventsub;

import lombok.Value;

import javax.annotation.Nullable;

/**
 * What the webhook endpoint answers once the signature has been verified.
 */
@Value
public class WebhookResult {
    private static final WebhookResult EMPTY = new WebhookResult(null);

    @Nullable
    String body;

    public static WebhookResult empty() {
        return EMPTY;
    }

    public static WebhookResult withBody(String body) {
        return new WebhookResult(body);
    }
}
