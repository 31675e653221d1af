package com.plyoox.stream.notifier.service.impl;

import com.plyoox.stream.notifier.exceptions.ConcurrencyException;
import com.plyoox.stream.notifier.model.AccessToken;
import com.plyoox.stream.notifier.model.twitch.TokenResponse;
import com.plyoox.stream.notifier.service.AppTokenService;
import com.plyoox.stream.notifier.service.TwitchAuthService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.plyoox.stream.notifier.model.Metrics.Counters.APP_TOKEN_REFRESHES;

@Slf4j
@Service
public class AppTokenServiceImpl implements AppTokenService {
    public static final Pair<String, Long> EXPIRY_SKEW_SEC = Pair.of("twitch.token.expiry.skew.sec", 30L);
    public static final Pair<String, Long> REFRESH_LOCK_WAIT_MS = Pair.of("twitch.token.refresh.lock.wait.ms", 10_000L);

    private static final AccessToken EMPTY = new AccessToken("", 0);

    private final TwitchAuthService twitchAuthService;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile AccessToken token = EMPTY;

    @Autowired
    public AppTokenServiceImpl(TwitchAuthService twitchAuthService,
                               ConfigurationService configurationService,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.twitchAuthService = twitchAuthService;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Nonnull
    @Override
    public AccessToken getValidToken() {
        AccessToken current = token;
        if (isUsable(current)) {
            return current;
        }
        return underRefreshLock(() -> {
            AccessToken fresh = token;
            if (isUsable(fresh)) {
                log.debug("getValidToken(): token was refreshed by another caller");
                return fresh;
            }
            return doRefresh();
        });
    }

    @Nonnull
    @Override
    public AccessToken refresh() {
        return underRefreshLock(this::doRefresh);
    }

    private AccessToken doRefresh() {
        TokenResponse response = twitchAuthService.exchangeAppToken();
        AccessToken newToken = new AccessToken(response.getAccessToken(), nowUnix() + response.getExpiresIn());
        token = newToken;
        meterRegistry.counter(APP_TOKEN_REFRESHES).increment();
        log.info("refresh(): app token refreshed, expires at {}", newToken.getExpiresAtUnix());
        return newToken;
    }

    private boolean isUsable(AccessToken candidate) {
        long skew = configurationService.get().getLong(EXPIRY_SKEW_SEC.getKey(), EXPIRY_SKEW_SEC.getValue());
        return candidate.isUsableAt(nowUnix(), skew);
    }

    private long nowUnix() {
        return clock.instant().getEpochSecond();
    }

    private AccessToken underRefreshLock(Supplier<AccessToken> action) {
        long waitMs = configurationService.get().getLong(REFRESH_LOCK_WAIT_MS.getKey(), REFRESH_LOCK_WAIT_MS.getValue());
        try {
            if (!refreshLock.tryLock(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("underRefreshLock(): could not acquire token refresh lock in {} ms", waitMs);
                throw new ConcurrencyException("Token refresh lock was not acquired in " + waitMs + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyException("Interrupted while waiting for token refresh lock", e);
        }
        try {
            return action.get();
        } finally {
            refreshLock.unlock();
        }
    }
}
