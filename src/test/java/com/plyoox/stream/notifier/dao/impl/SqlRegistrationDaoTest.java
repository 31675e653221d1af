package com.plyoox.stream.notifier.dao.impl;

import com.plyoox.stream.notifier.BaseTest;
import com.plyoox.stream.notifier.model.Broadcaster;
import com.plyoox.stream.notifier.model.Registration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlRegistrationDaoTest extends BaseTest {

    @BeforeEach
    void setUpBroadcasters() {
        for (long id = 1; id <= 2; id++) {
            broadcasterDao.upsert(Broadcaster.builder().id(id).displayName("b" + id).avatarUrl("a").eventSubscriptionId("es" + id).build());
        }
    }

    @Test
    void shouldGenerateIdsAndFindRegistrations() {
        long first = registrationDao.insert(100L, 1L);
        long second = registrationDao.insert(100L, 2L);

        assertNotEquals(first, second);
        assertThat(registrationDao.findById(first)).contains(Registration.builder().id(first).guildId(100L).broadcasterId(1L).build());
        assertThat(registrationDao.findByGuild(100L)).extracting(Registration::getId).containsExactly(first, second);
        assertThat(registrationDao.findByBroadcaster(2L)).extracting(Registration::getGuildId).containsExactly(100L);
        assertTrue(registrationDao.exists(100L, 1L));
        assertFalse(registrationDao.exists(200L, 1L));
    }

    @Test
    void shouldRejectDuplicateGuildAndBroadcaster() {
        registrationDao.insert(100L, 1L);

        assertThrows(DuplicateKeyException.class, () -> registrationDao.insert(100L, 1L));
    }

    @Test
    void shouldRejectUnknownBroadcaster() {
        assertThrows(DataIntegrityViolationException.class, () -> registrationDao.insert(100L, 42L));
    }

    @Test
    void shouldCountAndDelete() {
        long first = registrationDao.insert(100L, 1L);
        registrationDao.insert(200L, 1L);
        registrationDao.insert(200L, 2L);

        assertEquals(2, registrationDao.countByBroadcaster(1L));
        assertTrue(registrationDao.deleteById(first));
        assertFalse(registrationDao.deleteById(first));
        assertEquals(1, registrationDao.countByBroadcaster(1L));

        assertEquals(2, registrationDao.deleteByGuild(200L));
        assertEquals(0, registrationDao.deleteByGuild(200L));

        registrationDao.insert(300L, 2L);
        registrationDao.insert(400L, 2L);
        assertEquals(2, registrationDao.deleteByBroadcaster(2L));
        assertEquals(0, registrationDao.countByBroadcaster(2L));
    }
}
