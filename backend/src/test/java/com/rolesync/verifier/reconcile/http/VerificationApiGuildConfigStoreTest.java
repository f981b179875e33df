package com.rolesync.verifier.reconcile.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.GuildConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationApiGuildConfigStoreTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private VerificationApiGuildConfigStore store;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(2);

        VerifierProperties properties = new VerifierProperties();
        properties.getVerification().setBaseUrl(server.url("/").toString());
        properties.getVerification().setApiKey("secret-key");
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(
            "verification",
            100,
            Duration.ofSeconds(1),
            Clock.systemUTC(),
            Sleeper.system()
        );
        BackoffPolicy backoff = new BackoffPolicy(Duration.ZERO, 2.0, Duration.ZERO, 2);
        VerificationApiTransport transport = new VerificationApiTransport(
            properties,
            httpExecutor,
            limiter,
            backoff,
            new RecordingSleeper()
        );
        store = new VerificationApiGuildConfigStore(transport, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
        httpExecutor.shutdownNow();
    }

    @Test
    void readsRoleAndApproval() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"roleId\":\"99\",\"approved\":true}"));

        Optional<GuildConfig> config = store.find("7");

        assertThat(config).contains(new GuildConfig("7", "99", true));
        assertThat(config.get().isUsable()).isTrue();
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/v1/guild?guildId=7");
    }

    @Test
    void numericRoleIdIsReadAsText() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"roleId\":123456789012345678,\"approved\":false}"));

        Optional<GuildConfig> config = store.find("7");

        assertThat(config).isPresent();
        assertThat(config.get().verifiedRoleId()).isEqualTo("123456789012345678");
        assertThat(config.get().isUsable()).isFalse();
    }

    @Test
    void unknownGuildHasNoConfig() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"approved\":true}"));

        assertThat(store.find("7")).isEmpty();
        assertThat(store.find("7")).isEmpty();
    }

    @Test
    void persistentFailureIsRaised() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> store.find("7"))
            .isInstanceOf(VerificationApiException.class);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
