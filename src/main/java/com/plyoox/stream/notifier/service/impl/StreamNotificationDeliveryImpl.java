package com.plyoox.stream.notifier.service.impl;

import com.plyoox.stream.notifier.model.StreamOnlineNotification;
import com.plyoox.stream.notifier.model.twitch.StreamData;
import com.plyoox.stream.notifier.restClients.BotNotificationClient;
import com.plyoox.stream.notifier.service.StreamNotificationDelivery;
import com.plyoox.stream.notifier.service.TwitchApiService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static com.plyoox.stream.notifier.conf.CommonConfig.DELIVERY_EXECUTOR;
import static com.plyoox.stream.notifier.model.Metrics.Counters.DELIVERY_FAIL;
import static com.plyoox.stream.notifier.model.Metrics.Counters.DELIVERY_OK;
import static com.plyoox.stream.notifier.model.Metrics.Tags.ERROR_TYPE;

@Slf4j
@Service
public class StreamNotificationDeliveryImpl implements StreamNotificationDelivery {
    private final TwitchApiService twitchApiService;
    private final BotNotificationClient botNotificationClient;
    private final ExecutorService deliveryExecutor;
    private final MeterRegistry meterRegistry;

    @Autowired
    public StreamNotificationDeliveryImpl(TwitchApiService twitchApiService,
                                          BotNotificationClient botNotificationClient,
                                          @Qualifier(DELIVERY_EXECUTOR) ExecutorService deliveryExecutor,
                                          MeterRegistry meterRegistry) {
        this.twitchApiService = twitchApiService;
        this.botNotificationClient = botNotificationClient;
        this.deliveryExecutor = deliveryExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void notifyStreamOnlineAsync(long broadcasterId) {
        try {
            deliveryExecutor.execute(() -> lookupAndDeliver(broadcasterId));
        } catch (RejectedExecutionException e) {
            log.error("notifyStreamOnlineAsync(): delivery queue is full, notification for {} dropped", broadcasterId);
            meterRegistry.counter(DELIVERY_FAIL, Tags.of(ERROR_TYPE, "rejected")).increment();
        }
    }

    private void lookupAndDeliver(long broadcasterId) {
        StreamData stream;
        try {
            stream = twitchApiService.fetchLiveStream(broadcasterId);
        } catch (Exception e) {
            log.error("lookupAndDeliver(): cannot look up live stream of {}", broadcasterId, e);
            meterRegistry.counter(DELIVERY_FAIL, Tags.of(ERROR_TYPE, "stream_lookup")).increment();
            return;
        }
        try {
            deliver(StreamOnlineNotification.from(stream));
        } catch (Exception e) {
            log.error("lookupAndDeliver(): cannot notify bot about stream {} of {}", stream.getId(), broadcasterId, e);
            meterRegistry.counter(DELIVERY_FAIL, Tags.of(ERROR_TYPE, "bot")).increment();
        }
    }

    @Override
    public void deliver(@Nonnull StreamOnlineNotification notification) {
        botNotificationClient.notifyStreamOnline(notification.toQueryParams());
        meterRegistry.counter(DELIVERY_OK).increment();
        log.info("deliver(): bot notified about stream {} of {}", notification.getStreamId(), notification.getUserLogin());
    }
}
