package com.plyoox.stream.notifier.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.plyoox.stream.notifier.dao.BroadcasterDao;
import com.plyoox.stream.notifier.model.Broadcaster;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class SqlBroadcasterDao implements BroadcasterDao {
    @Language("PostgreSQL")
    public static final String SELECT_BY_ID_SQL = "" +
            "SELECT id, display_name, avatar_url, event_subscription_id " +
            "FROM broadcasters " +
            "WHERE id = :id";

    @Language("PostgreSQL")
    public static final String SELECT_WITH_SUBSCRIPTION_SQL = "" +
            "SELECT id, display_name, avatar_url, event_subscription_id " +
            "FROM broadcasters " +
            "WHERE event_subscription_id IS NOT NULL AND event_subscription_id <> ''";

    @Language("PostgreSQL")
    public static final String SELECT_UNREFERENCED_SQL = "" +
            "SELECT b.id, b.display_name, b.avatar_url, b.event_subscription_id " +
            "FROM broadcasters b " +
            "WHERE b.id IN (:ids) " +
            "AND NOT EXISTS (SELECT 1 FROM registrations r WHERE r.broadcaster_id = b.id)";

    @Language("PostgreSQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO broadcasters (id, display_name, avatar_url, event_subscription_id) " +
            "VALUES (:id, :displayName, :avatarUrl, :subscriptionId)";

    @Language("PostgreSQL")
    public static final String UPDATE_SQL = "" +
            "UPDATE broadcasters " +
            "SET display_name = :displayName, avatar_url = :avatarUrl, event_subscription_id = :subscriptionId " +
            "WHERE id = :id";

    @Language("PostgreSQL")
    public static final String UPDATE_PROFILE_SQL = "" +
            "UPDATE broadcasters " +
            "SET display_name = :displayName, avatar_url = :avatarUrl " +
            "WHERE id = :id";

    @Language("PostgreSQL")
    public static final String DELETE_SQL = "" +
            "DELETE FROM broadcasters WHERE id IN (:ids)";

    private static final RowMapper<Broadcaster> ROW_MAPPER = (rs, rowNum) -> Broadcaster.builder()
            .id(rs.getLong("id"))
            .displayName(rs.getString("display_name"))
            .avatarUrl(rs.getString("avatar_url"))
            .eventSubscriptionId(rs.getString("event_subscription_id"))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlBroadcasterDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Broadcaster> findById(long id) {
        return jdbcTemplate.query(SELECT_BY_ID_SQL, ImmutableMap.of("id", id), ROW_MAPPER).stream().findFirst();
    }

    @Override
    public List<Broadcaster> findAllWithSubscription() {
        return jdbcTemplate.query(SELECT_WITH_SUBSCRIPTION_SQL, ROW_MAPPER);
    }

    @Override
    public List<Broadcaster> findUnreferenced(@Nonnull Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        return jdbcTemplate.query(SELECT_UNREFERENCED_SQL, ImmutableMap.of("ids", ids), ROW_MAPPER);
    }

    @Override
    public void upsert(@Nonnull Broadcaster broadcaster) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", broadcaster.getId())
                .addValue("displayName", broadcaster.getDisplayName())
                .addValue("avatarUrl", broadcaster.getAvatarUrl())
                .addValue("subscriptionId", broadcaster.getEventSubscriptionId());
        // callers hold the broadcaster lock, so update-then-insert does not race
        if (jdbcTemplate.update(UPDATE_SQL, params) == 0) {
            jdbcTemplate.update(INSERT_SQL, params);
        }
    }

    @Override
    public boolean updateProfile(long id, @Nonnull String displayName, @Nonnull String avatarUrl) {
        Map<String, ?> params = ImmutableMap.of(
                "id", id,
                "displayName", displayName,
                "avatarUrl", avatarUrl);
        return jdbcTemplate.update(UPDATE_PROFILE_SQL, params) > 0;
    }

    @Override
    public boolean delete(long id) {
        return deleteAll(Collections.singleton(id)) > 0;
    }

    @Override
    public int deleteAll(@Nonnull Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update(DELETE_SQL, ImmutableMap.of("ids", ids));
    }
}
