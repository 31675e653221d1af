package com.plyoox.stream.notifier.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plyoox.stream.notifier.exceptions.NotifierException;
import com.plyoox.stream.notifier.exceptions.ValidationException;
import com.plyoox.stream.notifier.model.eventsub.ChallengePayload;
import com.plyoox.stream.notifier.model.eventsub.EventSubMessageType;
import com.plyoox.stream.notifier.model.eventsub.NotificationPayload;
import com.plyoox.stream.notifier.model.eventsub.RevocationPayload;
import com.plyoox.stream.notifier.model.eventsub.WebhookResult;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.service.EventSubDispatcher;
import com.plyoox.stream.notifier.service.StreamNotificationDelivery;
import com.plyoox.stream.notifier.service.SubscriptionManagerService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Optional;

import static com.plyoox.stream.notifier.model.Metrics.Counters.WEBHOOK_MESSAGES;
import static com.plyoox.stream.notifier.model.Metrics.Counters.WEBHOOK_PROCESSING_ERRORS;
import static com.plyoox.stream.notifier.model.Metrics.Tags.MESSAGE_TYPE;

@Slf4j
@Service
public class EventSubDispatcherImpl implements EventSubDispatcher {
    private final ObjectMapper objectMapper;
    private final SubscriptionManagerService subscriptionManagerService;
    private final StreamNotificationDelivery streamNotificationDelivery;
    private final MeterRegistry meterRegistry;

    @Autowired
    public EventSubDispatcherImpl(ObjectMapper objectMapper,
                                  SubscriptionManagerService subscriptionManagerService,
                                  StreamNotificationDelivery streamNotificationDelivery,
                                  MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.subscriptionManagerService = subscriptionManagerService;
        this.streamNotificationDelivery = streamNotificationDelivery;
        this.meterRegistry = meterRegistry;
    }

    @Nonnull
    @Override
    public WebhookResult dispatch(@Nonnull String messageType, @Nonnull byte[] rawBody) {
        Optional<EventSubMessageType> type = EventSubMessageType.byCode(messageType);
        meterRegistry.counter(WEBHOOK_MESSAGES, Tags.of(MESSAGE_TYPE, type.map(EventSubMessageType::getCode).orElse("unknown"))).increment();
        if (!type.isPresent()) {
            log.warn("dispatch(): unknown message type {}, ignored", messageType);
            return WebhookResult.empty();
        }

        switch (type.get()) {
            case WEBHOOK_CALLBACK_VERIFICATION:
                return handleChallenge(parse(rawBody, ChallengePayload.class));
            case NOTIFICATION:
                handleNotification(parse(rawBody, NotificationPayload.class));
                return WebhookResult.empty();
            case REVOCATION:
                handleRevocation(parse(rawBody, RevocationPayload.class));
                return WebhookResult.empty();
            default:
                return WebhookResult.empty();
        }
    }

    private WebhookResult handleChallenge(ChallengePayload payload) {
        if (payload.getChallenge() == null) {
            throw new ValidationException("Challenge is missing.");
        }
        log.info("handleChallenge(): verification requested for subscription {}", subscriptionId(payload.getSubscription()));
        return WebhookResult.withBody(payload.getChallenge());
    }

    private void handleNotification(NotificationPayload payload) {
        if (payload.getEvent() == null) {
            throw new ValidationException("Event is missing.");
        }
        long broadcasterId = parseUserId(payload.getEvent().getBroadcasterUserId());
        log.info("handleNotification(): {} went live, subscription {}", payload.getEvent().getBroadcasterUserLogin(),
                subscriptionId(payload.getSubscription()));
        streamNotificationDelivery.notifyStreamOnlineAsync(broadcasterId);
    }

    private void handleRevocation(RevocationPayload payload) {
        EventSubSubscription subscription = payload.getSubscription();
        if (subscription == null || subscription.getCondition() == null || StringUtils.isEmpty(subscription.getId())) {
            throw new ValidationException("Subscription is missing.");
        }
        long broadcasterId = parseUserId(subscription.getCondition().getBroadcasterUserId());
        log.warn("handleRevocation(): subscription {} of broadcaster {} revoked with status {}",
                subscription.getId(), broadcasterId, subscription.getStatus());
        try {
            subscriptionManagerService.revoke(broadcasterId, subscription.getId());
        } catch (NotifierException e) {
            log.error("handleRevocation(): cannot apply revocation of subscription {}", subscription.getId(), e);
            meterRegistry.counter(WEBHOOK_PROCESSING_ERRORS, Tags.of(MESSAGE_TYPE, EventSubMessageType.REVOCATION.getCode())).increment();
        }
    }

    private <T> T parse(byte[] rawBody, Class<T> type) {
        try {
            T payload = objectMapper.readValue(rawBody, type);
            if (payload == null) {
                throw new ValidationException("Empty webhook body.");
            }
            return payload;
        } catch (IOException e) {
            log.warn("parse(): malformed {} body: {}", type.getSimpleName(), e.getMessage());
            throw new ValidationException("Malformed webhook body.", e);
        }
    }

    private static long parseUserId(@Nullable String userId) {
        try {
            return Long.parseLong(StringUtils.trimToEmpty(userId));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid broadcaster id: " + userId, e);
        }
    }

    @Nullable
    private static String subscriptionId(@Nullable EventSubSubscription subscription) {
        return subscription == null ? null : subscription.getId();
    }
}
