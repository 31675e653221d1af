package com.plyoox.stream.notifier.dao;

import com.plyoox.stream.notifier.model.Broadcaster;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BroadcasterDao {
    Optional<Broadcaster> findById(long id);

    List<Broadcaster> findAllWithSubscription();

    /**
     * @return those of {@code ids} that no registration references anymore
     */
    List<Broadcaster> findUnreferenced(@Nonnull Collection<Long> ids);

    /**
     * Inserts the broadcaster or updates display name, avatar and subscription id of the existing row.
     */
    void upsert(@Nonnull Broadcaster broadcaster);

    boolean updateProfile(long id, @Nonnull String displayName, @Nonnull String avatarUrl);

    boolean delete(long id);

    int deleteAll(@Nonnull Collection<Long> ids);
}
