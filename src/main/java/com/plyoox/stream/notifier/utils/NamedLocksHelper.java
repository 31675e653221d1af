package com.plyoox.stream.notifier.utils;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

public class NamedLocksHelper {
    private static final String BROADCASTER_LOCAL_LOCK_PREFIX = "BROADCASTER.";

    @Nonnull
    public static String getBroadcasterLockName(long broadcasterId) {
        return BROADCASTER_LOCAL_LOCK_PREFIX + broadcasterId;
    }

    /**
     * Lock names in ascending broadcaster order, so that two multi-lock callers can never deadlock.
     */
    @Nonnull
    public static List<String> getBroadcasterLockNames(@Nonnull Collection<Long> broadcasterIds) {
        return broadcasterIds.stream()
                .distinct()
                .sorted()
                .map(NamedLocksHelper::getBroadcasterLockName)
                .collect(Collectors.toList());
    }
}
