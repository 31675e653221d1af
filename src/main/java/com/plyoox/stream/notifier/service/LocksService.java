package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.CallSpec;

import javax.annotation.Nonnull;

public interface LocksService {

    /**
     * Runs the action while holding every in-process lock named in {@code callSpec}.
     *
     * @throws com.plyoox.stream.notifier.exceptions.ConcurrencyException if a lock is not acquired in time
     */
    <T> T doUnderLock(@Nonnull CallSpec<T> callSpec);
}
