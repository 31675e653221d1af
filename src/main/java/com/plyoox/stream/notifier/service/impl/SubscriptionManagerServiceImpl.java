package com.plyoox.stream.notifier.service.impl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.plyoox.stream.notifier.dao.BroadcasterDao;
import com.plyoox.stream.notifier.dao.RegistrationDao;
import com.plyoox.stream.notifier.exceptions.ConcurrencyException;
import com.plyoox.stream.notifier.exceptions.ConflictException;
import com.plyoox.stream.notifier.exceptions.InternalException;
import com.plyoox.stream.notifier.exceptions.NotifierException;
import com.plyoox.stream.notifier.exceptions.PersistenceException;
import com.plyoox.stream.notifier.exceptions.SubscriptionConflictException;
import com.plyoox.stream.notifier.exceptions.ValidationException;
import com.plyoox.stream.notifier.model.Broadcaster;
import com.plyoox.stream.notifier.model.CallSpec;
import com.plyoox.stream.notifier.model.CreateNotificationRequest;
import com.plyoox.stream.notifier.model.Registration;
import com.plyoox.stream.notifier.model.SubscriptionState;
import com.plyoox.stream.notifier.model.twitch.EventSubSubscription;
import com.plyoox.stream.notifier.model.twitch.TokenResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;
import com.plyoox.stream.notifier.service.LocksService;
import com.plyoox.stream.notifier.service.SubscriptionManagerService;
import com.plyoox.stream.notifier.service.TwitchApiService;
import com.plyoox.stream.notifier.service.TwitchAuthService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.plyoox.stream.notifier.model.Metrics.Counters.SUBSCRIPTIONS_CREATED;
import static com.plyoox.stream.notifier.model.Metrics.Counters.SUBSCRIPTIONS_DELETED;
import static com.plyoox.stream.notifier.model.Metrics.Counters.SUBSCRIPTIONS_REVOKED;
import static com.plyoox.stream.notifier.utils.NamedLocksHelper.getBroadcasterLockName;
import static com.plyoox.stream.notifier.utils.NamedLocksHelper.getBroadcasterLockNames;

@Slf4j
@Service
public class SubscriptionManagerServiceImpl implements SubscriptionManagerService {
    public static final Pair<String, Long> LOCK_WAIT_MS = Pair.of("subscriptions.lock.wait.ms", 10_000L);
    static final int RELEASE_GUILD_MAX_ATTEMPTS = 3;

    private final TwitchAuthService twitchAuthService;
    private final TwitchApiService twitchApiService;
    private final BroadcasterDao broadcasterDao;
    private final RegistrationDao registrationDao;
    private final LocksService locksService;
    private final TransactionTemplate transactionTemplate;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final Set<Long> pendingBroadcasters = ConcurrentHashMap.newKeySet();

    @Autowired
    public SubscriptionManagerServiceImpl(TwitchAuthService twitchAuthService,
                                          TwitchApiService twitchApiService,
                                          BroadcasterDao broadcasterDao,
                                          RegistrationDao registrationDao,
                                          LocksService locksService,
                                          TransactionTemplate transactionTemplate,
                                          ConfigurationService configurationService,
                                          MeterRegistry meterRegistry) {
        this.twitchAuthService = twitchAuthService;
        this.twitchApiService = twitchApiService;
        this.broadcasterDao = broadcasterDao;
        this.registrationDao = registrationDao;
        this.locksService = locksService;
        this.transactionTemplate = transactionTemplate;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public long register(@Nonnull String code, long guildId) {
        if (code.length() != CreateNotificationRequest.CODE_LENGTH) {
            throw new ValidationException("Invalid authorization code.");
        }
        TokenResponse userToken = twitchAuthService.exchangeUserCode(code);
        TwitchUser user = twitchApiService.fetchUser(userToken.getAccessToken());
        long broadcasterId = user.getId();

        long registrationId = locksService.doUnderLock(CallSpec.<Long>builder()
                .lockNames(ImmutableList.of(getBroadcasterLockName(broadcasterId)))
                .waitTimeMs(getLockWaitTimeMs())
                .action(() -> inTransaction("register", () -> {
                    if (registrationDao.exists(guildId, broadcasterId)) {
                        throw new ConflictException(guildId, broadcasterId);
                    }
                    ensureSubscription(user);
                    broadcasterDao.updateProfile(broadcasterId, displayName(user), avatarUrl(user));
                    try {
                        return registrationDao.insert(guildId, broadcasterId);
                    } catch (DuplicateKeyException e) {
                        throw new ConflictException(guildId, broadcasterId);
                    }
                }))
                .build());
        log.info("register(): guild {} registered for broadcaster {}, registration {}", guildId, broadcasterId, registrationId);
        return registrationId;
    }

    @Nonnull
    @Override
    public String ensureSubscription(@Nonnull TwitchUser user) {
        long broadcasterId = user.getId();
        Optional<Broadcaster> existing = broadcasterDao.findById(broadcasterId);
        if (existing.isPresent() && existing.get().hasSubscription()) {
            return existing.get().getEventSubscriptionId();
        }

        pendingBroadcasters.add(broadcasterId);
        try {
            String subscriptionId = createOrReuseSubscription(broadcasterId);
            broadcasterDao.upsert(Broadcaster.builder()
                    .id(broadcasterId)
                    .displayName(displayName(user))
                    .avatarUrl(avatarUrl(user))
                    .eventSubscriptionId(subscriptionId)
                    .build());
            return subscriptionId;
        } finally {
            pendingBroadcasters.remove(broadcasterId);
        }
    }

    private String createOrReuseSubscription(long broadcasterId) {
        try {
            String subscriptionId = twitchApiService.createSubscription(broadcasterId);
            meterRegistry.counter(SUBSCRIPTIONS_CREATED).increment();
            return subscriptionId;
        } catch (SubscriptionConflictException e) {
            String subscriptionId = twitchApiService.findSubscriptionByUser(broadcasterId)
                    .map(EventSubSubscription::getId)
                    .orElseThrow(() -> {
                        log.error("createOrReuseSubscription(): Twitch reported a conflict for broadcaster {} but lists no subscription", broadcasterId);
                        return new InternalException("Conflicting subscription for broadcaster " + broadcasterId + " not found");
                    });
            log.info("createOrReuseSubscription(): reusing existing subscription {} for broadcaster {}", subscriptionId, broadcasterId);
            return subscriptionId;
        }
    }

    @Override
    public void releaseRegistration(long registrationId) {
        Registration registration = persistence("findRegistration", () -> registrationDao.findById(registrationId))
                .orElseThrow(() -> new ValidationException("Notification does not exist."));
        long broadcasterId = registration.getBroadcasterId();

        Optional<String> releasedSubscription = locksService.doUnderLock(CallSpec.<Optional<String>>builder()
                .lockNames(ImmutableList.of(getBroadcasterLockName(broadcasterId)))
                .waitTimeMs(getLockWaitTimeMs())
                .action(() -> inTransaction("releaseRegistration", () -> {
                    if (!registrationDao.deleteById(registrationId)) {
                        throw new ValidationException("Notification does not exist.");
                    }
                    if (registrationDao.countByBroadcaster(broadcasterId) > 0) {
                        return Optional.<String>empty();
                    }
                    Optional<Broadcaster> broadcaster = broadcasterDao.findById(broadcasterId);
                    broadcasterDao.delete(broadcasterId);
                    return broadcaster.map(Broadcaster::getEventSubscriptionId).filter(StringUtils::isNotEmpty);
                }))
                .build());
        log.info("releaseRegistration(): registration {} of guild {} removed", registrationId, registration.getGuildId());
        releasedSubscription.ifPresent(this::deleteRemoteSubscription);
    }

    @Override
    public void releaseGuild(long guildId) {
        Set<Long> lockedIds = new TreeSet<>(guildBroadcasterIds(persistence("findGuildRegistrations", () -> registrationDao.findByGuild(guildId))));
        if (lockedIds.isEmpty()) {
            log.info("releaseGuild(): guild {} has no registrations", guildId);
            return;
        }

        for (int attempt = 1; attempt <= RELEASE_GUILD_MAX_ATTEMPTS; attempt++) {
            Set<Long> attemptIds = ImmutableSet.copyOf(lockedIds);
            Optional<List<String>> releasedSubscriptions = locksService.doUnderLock(CallSpec.<Optional<List<String>>>builder()
                    .lockNames(getBroadcasterLockNames(attemptIds))
                    .waitTimeMs(getLockWaitTimeMs())
                    .action(() -> inTransaction("releaseGuild", () -> {
                        List<Long> currentIds = guildBroadcasterIds(registrationDao.findByGuild(guildId));
                        if (!attemptIds.containsAll(currentIds)) {
                            lockedIds.addAll(currentIds);
                            return Optional.<List<String>>empty();
                        }
                        int deleted = registrationDao.deleteByGuild(guildId);
                        List<Broadcaster> unreferenced = broadcasterDao.findUnreferenced(currentIds);
                        broadcasterDao.deleteAll(unreferenced.stream().map(Broadcaster::getId).collect(Collectors.toList()));
                        log.info("releaseGuild(): removed {} registrations and {} broadcasters of guild {}", deleted, unreferenced.size(), guildId);
                        return Optional.of(unreferenced.stream()
                                .map(Broadcaster::getEventSubscriptionId)
                                .filter(StringUtils::isNotEmpty)
                                .collect(Collectors.toList()));
                    }))
                    .build());
            if (releasedSubscriptions.isPresent()) {
                releasedSubscriptions.get().forEach(this::deleteRemoteSubscription);
                return;
            }
            log.info("releaseGuild(): registrations of guild {} changed while locking, retrying with broadcasters {}", guildId, lockedIds);
        }
        log.warn("releaseGuild(): registrations of guild {} kept changing, gave up after {} attempts", guildId, RELEASE_GUILD_MAX_ATTEMPTS);
        throw new ConcurrencyException("Registrations of guild " + guildId + " changed concurrently");
    }

    @Override
    public void revoke(long broadcasterId, @Nonnull String subscriptionId) {
        meterRegistry.counter(SUBSCRIPTIONS_REVOKED).increment();
        locksService.doUnderLock(CallSpec.<Void>builder()
                .lockNames(ImmutableList.of(getBroadcasterLockName(broadcasterId)))
                .waitTimeMs(getLockWaitTimeMs())
                .action(() -> inTransaction("revoke", () -> {
                    Optional<Broadcaster> broadcaster = broadcasterDao.findById(broadcasterId);
                    if (!broadcaster.isPresent()) {
                        log.info("revoke(): broadcaster {} is not tracked, subscription {}", broadcasterId, subscriptionId);
                        return null;
                    }
                    String knownSubscription = broadcaster.get().getEventSubscriptionId();
                    if (StringUtils.isNotEmpty(knownSubscription) && !knownSubscription.equals(subscriptionId)) {
                        log.warn("revoke(): revoked subscription {} is not the current one {} of broadcaster {}, ignored",
                                subscriptionId, knownSubscription, broadcasterId);
                        return null;
                    }
                    List<Long> guildIds = registrationDao.findByBroadcaster(broadcasterId).stream()
                            .map(Registration::getGuildId)
                            .collect(Collectors.toList());
                    registrationDao.deleteByBroadcaster(broadcasterId);
                    broadcasterDao.delete(broadcasterId);
                    log.warn("revoke(): subscription {} of broadcaster {} revoked, registrations of guilds {} removed",
                            subscriptionId, broadcasterId, guildIds);
                    return null;
                }))
                .build());
    }

    @Nonnull
    @Override
    public SubscriptionState getState(long broadcasterId) {
        if (pendingBroadcasters.contains(broadcasterId)) {
            return SubscriptionState.PENDING;
        }
        return persistence("getState", () -> broadcasterDao.findById(broadcasterId))
                .filter(Broadcaster::hasSubscription)
                .map(b -> SubscriptionState.ACTIVE)
                .orElse(SubscriptionState.ABSENT);
    }

    private void deleteRemoteSubscription(String subscriptionId) {
        try {
            twitchApiService.deleteSubscription(subscriptionId);
            meterRegistry.counter(SUBSCRIPTIONS_DELETED).increment();
        } catch (NotifierException e) {
            log.warn("deleteRemoteSubscription(): subscription {} left on Twitch, it will be swept later", subscriptionId, e);
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> action) {
        return persistence(operation, () -> transactionTemplate.execute(status -> action.get()));
    }

    private <T> T persistence(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("{}(): database operation failed", operation, e);
            throw new PersistenceException(operation, e);
        }
    }

    private static List<Long> guildBroadcasterIds(List<Registration> registrations) {
        return registrations.stream()
                .map(Registration::getBroadcasterId)
                .collect(Collectors.toList());
    }

    private long getLockWaitTimeMs() {
        return configurationService.get().getLong(LOCK_WAIT_MS.getKey(), LOCK_WAIT_MS.getValue());
    }

    private static String displayName(TwitchUser user) {
        return StringUtils.defaultIfEmpty(user.getDisplayName(), StringUtils.defaultString(user.getLogin()));
    }

    private static String avatarUrl(TwitchUser user) {
        return StringUtils.defaultString(user.getProfileImageUrl());
    }
}
