package com.plyoox.stream.notifier.service;

import com.plyoox.stream.notifier.model.SweepResult;

import javax.annotation.Nonnull;

/**
 * Removes remote subscriptions that no broadcaster references, e.g. left behind when a delete
 * call failed after the local commit.
 */
public interface SubscriptionSweepService {

    @Nonnull
    SweepResult sweep();
}
