package com.plyoox.stream.notifier.model;

public interface Metrics {

    String BASE_METRIC_PREFIX = "stream.notifier";

    interface Counters {
        String WEBHOOK_MESSAGES = m("webhook.messages");
        String WEBHOOK_SIGNATURE_FAILURES = m("webhook.signature.fail");
        String WEBHOOK_PROCESSING_ERRORS = m("webhook.processing.error");

        String TWITCH_API_ERRORS = m("twitch.api.error");
        String APP_TOKEN_REFRESHES = m("twitch.token.refresh");

        String DELIVERY_OK = m("delivery.ok");
        String DELIVERY_FAIL = m("delivery.fail");

        String SUBSCRIPTIONS_CREATED = m("subscriptions.created");
        String SUBSCRIPTIONS_DELETED = m("subscriptions.deleted");
        String SUBSCRIPTIONS_REVOKED = m("subscriptions.revoked");
        String ORPHANS_SWEPT = m("subscriptions.orphans.swept");

        String UNDER_LOCK_ERRORS = m("lock.error");
    }

    interface Tags {
        String MESSAGE_TYPE = "message_type";
        String OPERATION = "operation";
        String STATUS = "status";
        String ERROR_TYPE = "error_type";
    }

    static String m(String metric) {
        return String.join(".", BASE_METRIC_PREFIX, metric);
    }
}
