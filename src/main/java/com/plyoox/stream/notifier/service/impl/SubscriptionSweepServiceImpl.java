package com.plyoox.stream.notifier.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.plyoox.stream.notifier.dao.BroadcasterDao;
import com.plyoox.stream.notifier.exceptions.NotifierException;
import com.plyoox.stream.notifier.model.Broadcaster;
import com.plyoox.stream.notifier.model.SweepResult;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.service.SubscriptionSweepService;
import com.plyoox.stream.notifier.service.TwitchApiService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.plyoox.stream.notifier.model.Metrics.Counters.ORPHANS_SWEPT;

@Slf4j
@Service
public class SubscriptionSweepServiceImpl implements SubscriptionSweepService {
    static final Pair<String, Boolean> IS_SWEEP_ENABLED = Pair.of("subscriptions.sweep.enable", true);
    static final Pair<String, Long> SWEEP_PERIOD_SECONDS = Pair.of("subscriptions.sweep.period.seconds", 3600L);
    static final Pair<String, Long> SWEEP_GRACE_SECONDS = Pair.of("subscriptions.sweep.grace.seconds", 600L);
    static final Pair<String, Integer> SWEEP_MAX_PAGES = Pair.of("subscriptions.sweep.max.pages", 100);

    private final ScheduledExecutorService sweepExecutorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("subscription-sweep-thread-%d")
            .daemon(true)
            .build());

    private final TwitchApiService twitchApiService;
    private final BroadcasterDao broadcasterDao;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final String callbackUrl;

    @Autowired
    public SubscriptionSweepServiceImpl(TwitchApiService twitchApiService,
                                        BroadcasterDao broadcasterDao,
                                        ConfigurationService configurationService,
                                        MeterRegistry meterRegistry,
                                        Clock clock,
                                        @Value("${twitch.eventsub.callback-url}") String callbackUrl) {
        this.twitchApiService = twitchApiService;
        this.broadcasterDao = broadcasterDao;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.callbackUrl = callbackUrl;
    }

    @PostConstruct
    void init() {
        scheduleNext();
    }

    @VisibleForTesting
    void runScheduledSweep() {
        try {
            if (configurationService.get().getBoolean(IS_SWEEP_ENABLED.getKey(), IS_SWEEP_ENABLED.getValue())) {
                SweepResult result = sweep();
                log.info("runScheduledSweep(): {}", result);
            }
        } catch (Exception e) {
            log.error("runScheduledSweep(): sweep failed", e);
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (sweepExecutorService.isShutdown()) {
            return;
        }
        long periodSeconds = configurationService.get().getLong(SWEEP_PERIOD_SECONDS.getKey(), SWEEP_PERIOD_SECONDS.getValue());
        sweepExecutorService.schedule(this::runScheduledSweep, periodSeconds, TimeUnit.SECONDS);
    }

    @Nonnull
    @Override
    public SweepResult sweep() {
        Set<String> knownSubscriptions;
        try {
            knownSubscriptions = broadcasterDao.findAllWithSubscription().stream()
                    .map(Broadcaster::getEventSubscriptionId)
                    .collect(Collectors.toSet());
        } catch (DataAccessException e) {
            log.error("sweep(): cannot read known subscriptions, sweep skipped", e);
            return SweepResult.skipped();
        }

        Duration grace = Duration.ofSeconds(configurationService.get().getLong(SWEEP_GRACE_SECONDS.getKey(), SWEEP_GRACE_SECONDS.getValue()));
        int maxPages = configurationService.get().getInt(SWEEP_MAX_PAGES.getKey(), SWEEP_MAX_PAGES.getValue());
        Instant deleteCreatedBefore = clock.instant().minus(grace);

        Set<String> remoteSubscriptions = new HashSet<>();
        int checked = 0;
        int deleted = 0;
        int failed = 0;
        boolean complete = false;
        String cursor = null;
        for (int page = 0; page < maxPages; page++) {
            TwitchDataResponse<EventSubSubscription> response;
            try {
                response = twitchApiService.listSubscriptions(cursor);
            } catch (NotifierException e) {
                log.error("sweep(): cannot list subscriptions, stopping at page {}", page, e);
                break;
            }
            for (EventSubSubscription subscription : response.getData()) {
                if (!isOurs(subscription)) {
                    continue;
                }
                checked++;
                remoteSubscriptions.add(subscription.getId());
                if (knownSubscriptions.contains(subscription.getId()) || !isCreatedBefore(subscription, deleteCreatedBefore)) {
                    continue;
                }
                try {
                    twitchApiService.deleteSubscription(subscription.getId());
                    deleted++;
                    meterRegistry.counter(ORPHANS_SWEPT).increment();
                    log.info("sweep(): orphaned subscription {} of broadcaster {} deleted", subscription.getId(), broadcasterOf(subscription));
                } catch (NotifierException e) {
                    failed++;
                    log.warn("sweep(): cannot delete orphaned subscription {}", subscription.getId(), e);
                }
            }
            Optional<String> nextCursor = response.nextCursor();
            if (!nextCursor.isPresent()) {
                complete = true;
                break;
            }
            cursor = nextCursor.get();
        }

        int missingRemotely = 0;
        if (complete) {
            for (String subscriptionId : knownSubscriptions) {
                if (!remoteSubscriptions.contains(subscriptionId)) {
                    missingRemotely++;
                    log.warn("sweep(): subscription {} is referenced locally but does not exist on Twitch", subscriptionId);
                }
            }
        }
        return SweepResult.builder()
                .checked(checked)
                .deleted(deleted)
                .failed(failed)
                .missingRemotely(missingRemotely)
                .build();
    }

    private boolean isOurs(EventSubSubscription subscription) {
        return EventSubSubscription.STREAM_ONLINE.equals(subscription.getType())
                && subscription.getTransport() != null
                && StringUtils.equals(callbackUrl, subscription.getTransport().getCallback());
    }

    private static boolean isCreatedBefore(EventSubSubscription subscription, Instant threshold) {
        if (subscription.getCreatedAt() == null) {
            return false;
        }
        try {
            return Instant.parse(subscription.getCreatedAt()).isBefore(threshold);
        } catch (DateTimeParseException e) {
            log.warn("isCreatedBefore(): subscription {} has unreadable created_at {}, kept", subscription.getId(), subscription.getCreatedAt());
            return false;
        }
    }

    @Nullable
    private static String broadcasterOf(EventSubSubscription subscription) {
        return subscription.getCondition() == null ? null : subscription.getCondition().getBroadcasterUserId();
    }

    @PreDestroy
    void shutdown() {
        sweepExecutorService.shutdownNow();
    }
}
