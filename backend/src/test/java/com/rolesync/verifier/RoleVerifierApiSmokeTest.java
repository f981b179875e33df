package com.rolesync.verifier;

import com.rolesync.verifier.config.VerifierProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class RoleVerifierApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private VerifierProperties properties;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void propertiesAreBoundAndNormalized() {
        assertThat(properties.getVerification().getApiKey()).isEqualTo("test-key");
        assertThat(properties.getDiscord().getBaseUrl()).isEqualTo("http://localhost:1/api/v10");
        assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(2);
        assertThat(properties.effectiveBatchConcurrency()).isEqualTo(4);
    }

    @Test
    void statusWithoutJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/guilds/7/reverify"))
            .andExpect(status().isNotFound());
    }

    @Test
    void cancelWithoutJobSaysSo() throws Exception {
        mockMvc.perform(post("/api/guilds/7/reverify/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("No verification job is running for this server."))
            .andExpect(jsonPath("$.ephemeral").value(false));
    }

    @Test
    void verifyEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/guilds/7/members/42/verify"))
            .andExpect(status().isMethodNotAllowed());
    }
}
