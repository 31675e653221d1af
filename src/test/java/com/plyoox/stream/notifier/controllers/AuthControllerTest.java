package com.plyoox.stream.notifier.controllers;

import com.plyoox.stream.notifier.BaseTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AuthControllerTest extends BaseTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    public void shouldReturnLoginUrl() throws Exception {
        mockMvc.perform(get("/service/twitch/auth").param("state", "guild 42"))
                .andExpect(status().isOk())
                .andExpect(content().string("http://localhost:1/oauth2/authorize?response_type=code&client_id=test-client"
                        + "&redirect_uri=http%3A%2F%2Flocalhost%2Fauth%2Fcallback&scope=user:read:email&state=guild+42"));
    }
}
