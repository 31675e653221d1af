package com.plyoox.stream.notifier.dao;

import com.plyoox.stream.notifier.model.Registration;

import java.util.List;
import java.util.Optional;

public interface RegistrationDao {
    /**
     * @return generated registration id
     */
    long insert(long guildId, long broadcasterId);

    Optional<Registration> findById(long id);

    boolean exists(long guildId, long broadcasterId);

    int countByBroadcaster(long broadcasterId);

    List<Registration> findByGuild(long guildId);

    List<Registration> findByBroadcaster(long broadcasterId);

    boolean deleteById(long id);

    int deleteByGuild(long guildId);

    int deleteByBroadcaster(long broadcasterId);
}
