package com.plyoox.stream.notifier.controllers;

import com.plyoox.stream.notifier.model.ExceptionResponse;
import com.plyoox.stream.notifier.model.eventsub.WebhookResult;
import com.plyoox.stream.notifier.service.EventSubDispatcher;
import com.plyoox.stream.notifier.utils.EventSubSignatures;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import static com.plyoox.stream.notifier.model.Metrics.Counters.WEBHOOK_SIGNATURE_FAILURES;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_ID;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_SIGNATURE;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_TIMESTAMP;
import static com.plyoox.stream.notifier.model.eventsub.EventSubHeaders.MESSAGE_TYPE;

/**
 * EventSub webhook callback. The signature is checked against the raw body before anything is parsed.
 */
@Slf4j
@RestController
public class EventSubController {
    private static final byte[] EMPTY_BODY = new byte[0];

    private final EventSubDispatcher eventSubDispatcher;
    private final MeterRegistry meterRegistry;
    private final String eventSubSecret;

    @Autowired
    public EventSubController(EventSubDispatcher eventSubDispatcher,
                              MeterRegistry meterRegistry,
                              @Value("${twitch.eventsub.secret}") String eventSubSecret) {
        this.eventSubDispatcher = eventSubDispatcher;
        this.meterRegistry = meterRegistry;
        this.eventSubSecret = EventSubSignatures.requireValidSecret(eventSubSecret);
    }

    @PostMapping("/_notify/twitch")
    public ResponseEntity<?> onEvent(@RequestHeader(MESSAGE_ID) String messageId,
                                     @RequestHeader(MESSAGE_SIGNATURE) String signature,
                                     @RequestHeader(MESSAGE_TIMESTAMP) String timestamp,
                                     @RequestHeader(MESSAGE_TYPE) String messageType,
                                     @RequestBody(required = false) byte[] body) {
        byte[] rawBody = body == null ? EMPTY_BODY : body;
        if (!EventSubSignatures.verify(messageId, timestamp, rawBody, signature, eventSubSecret)) {
            log.warn("onEvent(): invalid signature for message {} of type {}", messageId, messageType);
            meterRegistry.counter(WEBHOOK_SIGNATURE_FAILURES).increment();
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ExceptionResponse(HttpStatus.UNAUTHORIZED.value(), "Invalid signature.", null, null));
        }

        WebhookResult result = eventSubDispatcher.dispatch(messageType, rawBody);
        if (result.getBody() == null) {
            return ResponseEntity.ok().build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(result.getBody());
    }
}
