package com.plyoox.stream.notifier.service.impl;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.Lists;
import com.plyoox.stream.notifier.exceptions.ConcurrencyException;
import com.plyoox.stream.notifier.exceptions.LockAcquiringFail;
import com.plyoox.stream.notifier.model.CallSpec;
import com.plyoox.stream.notifier.service.LocksService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static com.plyoox.stream.notifier.model.Metrics.Counters.UNDER_LOCK_ERRORS;
import static com.plyoox.stream.notifier.model.Metrics.Tags.ERROR_TYPE;

@Slf4j
@Service
public class LocksServiceImpl implements LocksService {
    // weak values: a lock stays cached while any thread still holds a reference to it
    private final Cache<String, Lock> localNamedLockCache;
    private final MeterRegistry meterRegistry;

    @Autowired
    public LocksServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.localNamedLockCache = CacheBuilder.newBuilder()
                .weakValues()
                .build();
    }

    @Override
    public <T> T doUnderLock(@Nonnull CallSpec<T> callSpec) {
        List<Lock> localLocks = getOrCreateLocalLocks(callSpec.getLockNames());
        List<Lock> acquiredLocks = Lists.newArrayList();
        try {
            tryAcquireLocalLocks(localLocks, callSpec.getLockNames(), callSpec.getWaitTimeMs(), acquiredLocks);
            return callSpec.getAction().call();
        } catch (InterruptedException e) {
            log.error("doUnderLock(): interrupted when work under lock: {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "interrupts")).increment();
            Thread.currentThread().interrupt();
            throw new ConcurrencyException("Interrupted while waiting for " + callSpec.getLockNames(), e);
        } catch (LockAcquiringFail e) {
            log.warn("doUnderLock(): couldn't acquire lock {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "try_llock_fail")).increment();
            throw e;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            log.error("doUnderLock(): unexpected checked error when work under lock {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "logic")).increment();
            throw new IllegalStateException(e);
        } finally {
            releaseLocks(acquiredLocks);
        }
    }

    private void tryAcquireLocalLocks(@Nonnull List<Lock> localLocks,
                                      @Nonnull List<String> lockNames,
                                      long waitTimeMs,
                                      @Nonnull List<Lock> acquiredLocks) throws InterruptedException {
        for (int i = 0; i < localLocks.size(); ++i) {
            Lock lock = localLocks.get(i);
            boolean lockAcquired = lock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS);
            if (!lockAcquired) {
                throw new LockAcquiringFail("try_llock_fail: " + lockNames.get(i));
            }
            acquiredLocks.add(lock);
        }
    }

    private void releaseLocks(@Nonnull List<? extends Lock> locks) {
        Lists.reverse(locks).forEach(Lock::unlock);
    }

    @Nonnull
    private Lock getOrCreateLocalLock(@Nonnull String name) {
        try {
            return localNamedLockCache.get(name, ReentrantLock::new);
        } catch (ExecutionException e) {
            throw new ConcurrencyException("Cannot create lock " + name, e);
        }
    }

    @Nonnull
    private List<Lock> getOrCreateLocalLocks(@Nonnull List<String> lockNames) {
        return lockNames.stream().map(this::getOrCreateLocalLock).collect(Collectors.toList());
    }
}
