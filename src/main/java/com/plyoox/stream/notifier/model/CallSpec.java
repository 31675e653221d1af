package com.plyoox.stream.notifier.model;

import com.google.common.collect.Lists;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.Callable;

@Value
@Builder
public class CallSpec<T> {
    /**
     * Ordering of locks is caller responsibility!
     */
    @Nonnull
    @NonNull
    @Builder.Default
    List<String> lockNames = Lists.newArrayList();
    @Nonnull
    @NonNull
    Callable<T> action;
    long waitTimeMs;
}
