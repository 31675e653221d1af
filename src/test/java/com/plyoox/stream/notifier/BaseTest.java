package com.plyoox.stream.notifier;

import com.google.common.collect.ImmutableList;
import com.plyoox.stream.notifier.dao.BroadcasterDao;
import com.plyoox.stream.notifier.dao.RegistrationDao;
import com.plyoox.stream.notifier.model.twitch.TokenResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchDataResponse;
import com.plyoox.stream.notifier.model.twitch.TwitchUser;
import com.plyoox.stream.notifier.restClients.BotNotificationClient;
import com.plyoox.stream.notifier.restClients.TwitchAuthClient;
import com.plyoox.stream.notifier.restClients.TwitchHelixClient;
import com.plyoox.stream.notifier.service.impl.ConfigurationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.HashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class BaseTest {
    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    public static final String APP_TOKEN = "app-token";
    public static final String USER_TOKEN = "user-token";
    public static final String EVENTSUB_SECRET = "s3cr3t-eventsub";
    public static final String CALLBACK_URL = "http://localhost/_notify/twitch";

    private final Map<String, Object> overriddenProperties = new HashMap<>();

    @MockBean
    protected TwitchAuthClient twitchAuthClient;
    @MockBean
    protected TwitchHelixClient twitchHelixClient;
    @MockBean
    protected BotNotificationClient botNotificationClient;
    @Autowired
    protected BroadcasterDao broadcasterDao;
    @Autowired
    protected RegistrationDao registrationDao;
    @Autowired
    protected ConfigurationService configurationService;
    @Autowired
    protected JdbcTemplate jdbcTemplate;

    public void setProperty(String key, Object value) {
        overriddenProperties.putIfAbsent(key, configurationService.get().getProperty(key));
        configurationService.update(configuration -> configuration.setProperty(key, value));
    }

    public void resetOverriddenProperties() {
        for (String key : overriddenProperties.keySet()) {
            Object value = overriddenProperties.get(key);
            if (value == null) {
                configurationService.update(configuration -> configuration.clearProperty(key));
            } else {
                configurationService.update(configuration -> configuration.setProperty(key, value));
            }
        }
        overriddenProperties.clear();
    }

    @BeforeEach
    public void stubTokenEndpoint() {
        lenient().when(twitchAuthClient.exchangeToken(anyMap())).thenAnswer(invocation -> {
            Map<String, ?> form = invocation.getArgument(0);
            String token = "client_credentials".equals(form.get("grant_type")) ? APP_TOKEN : USER_TOKEN;
            return ResponseEntity.ok(new TokenResponse(token, null, 3600, "bearer"));
        });
    }

    @BeforeEach
    @AfterEach
    public void clear() {
        try {
            jdbcTemplate.update("DELETE FROM registrations");
            jdbcTemplate.update("DELETE FROM broadcasters");
        } finally {
            resetOverriddenProperties();
        }
    }

    protected void stubUser(long id, String displayName) {
        TwitchUser user = TwitchUser.builder()
                .id(id)
                .login(displayName.toLowerCase())
                .displayName(displayName)
                .profileImageUrl("https://static-cdn.jtvnw.net/" + id + ".png")
                .build();
        lenient().when(twitchHelixClient.getUsers(eq("Bearer " + USER_TOKEN), any()))
                .thenReturn(ResponseEntity.ok(TwitchDataResponse.of(ImmutableList.of(user))));
    }
}
