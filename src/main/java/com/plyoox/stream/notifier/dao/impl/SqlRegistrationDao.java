package com.plyoox.stream.notifier.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.plyoox.stream.notifier.dao.RegistrationDao;
import com.plyoox.stream.notifier.model.Registration;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class SqlRegistrationDao implements RegistrationDao {
    @Language("PostgreSQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO registrations (guild_id, broadcaster_id) " +
            "VALUES (:guildId, :broadcasterId)";

    @Language("PostgreSQL")
    public static final String SELECT_BY_ID_SQL = "" +
            "SELECT id, guild_id, broadcaster_id FROM registrations WHERE id = :id";

    @Language("PostgreSQL")
    public static final String EXISTS_SQL = "" +
            "SELECT count(*) FROM registrations WHERE guild_id = :guildId AND broadcaster_id = :broadcasterId";

    @Language("PostgreSQL")
    public static final String COUNT_BY_BROADCASTER_SQL = "" +
            "SELECT count(*) FROM registrations WHERE broadcaster_id = :broadcasterId";

    @Language("PostgreSQL")
    public static final String SELECT_BY_GUILD_SQL = "" +
            "SELECT id, guild_id, broadcaster_id FROM registrations WHERE guild_id = :guildId ORDER BY id";

    @Language("PostgreSQL")
    public static final String SELECT_BY_BROADCASTER_SQL = "" +
            "SELECT id, guild_id, broadcaster_id FROM registrations WHERE broadcaster_id = :broadcasterId ORDER BY id";

    @Language("PostgreSQL")
    public static final String DELETE_BY_ID_SQL = "" +
            "DELETE FROM registrations WHERE id = :id";

    @Language("PostgreSQL")
    public static final String DELETE_BY_GUILD_SQL = "" +
            "DELETE FROM registrations WHERE guild_id = :guildId";

    @Language("PostgreSQL")
    public static final String DELETE_BY_BROADCASTER_SQL = "" +
            "DELETE FROM registrations WHERE broadcaster_id = :broadcasterId";

    private static final RowMapper<Registration> ROW_MAPPER = (rs, rowNum) -> Registration.builder()
            .id(rs.getLong("id"))
            .guildId(rs.getLong("guild_id"))
            .broadcasterId(rs.getLong("broadcaster_id"))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlRegistrationDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long insert(long guildId, long broadcasterId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("guildId", guildId)
                .addValue("broadcasterId", broadcasterId);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(INSERT_SQL, params, keyHolder, new String[]{"id"});
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("No id generated for registration of guild " + guildId);
        }
        return key.longValue();
    }

    @Override
    public Optional<Registration> findById(long id) {
        return jdbcTemplate.query(SELECT_BY_ID_SQL, ImmutableMap.of("id", id), ROW_MAPPER).stream().findFirst();
    }

    @Override
    public boolean exists(long guildId, long broadcasterId) {
        Map<String, ?> params = ImmutableMap.of(
                "guildId", guildId,
                "broadcasterId", broadcasterId);
        Integer count = jdbcTemplate.queryForObject(EXISTS_SQL, params, Integer.class);
        return count != null && count > 0;
    }

    @Override
    public int countByBroadcaster(long broadcasterId) {
        Integer count = jdbcTemplate.queryForObject(COUNT_BY_BROADCASTER_SQL, ImmutableMap.of("broadcasterId", broadcasterId), Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public List<Registration> findByGuild(long guildId) {
        return jdbcTemplate.query(SELECT_BY_GUILD_SQL, ImmutableMap.of("guildId", guildId), ROW_MAPPER);
    }

    @Override
    public List<Registration> findByBroadcaster(long broadcasterId) {
        return jdbcTemplate.query(SELECT_BY_BROADCASTER_SQL, ImmutableMap.of("broadcasterId", broadcasterId), ROW_MAPPER);
    }

    @Override
    public boolean deleteById(long id) {
        return jdbcTemplate.update(DELETE_BY_ID_SQL, ImmutableMap.of("id", id)) > 0;
    }

    @Override
    public int deleteByGuild(long guildId) {
        return jdbcTemplate.update(DELETE_BY_GUILD_SQL, ImmutableMap.of("guildId", guildId));
    }

    @Override
    public int deleteByBroadcaster(long broadcasterId) {
        return jdbcTemplate.update(DELETE_BY_BROADCASTER_SQL, ImmutableMap.of("broadcasterId", broadcasterId));
    }
}
