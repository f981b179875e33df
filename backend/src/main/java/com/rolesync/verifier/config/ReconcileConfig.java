package com.rolesync.verifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rolesync.verifier.reconcile.http.BackoffPolicy;
import com.rolesync.verifier.reconcile.http.Sleeper;
import com.rolesync.verifier.reconcile.http.TokenBucketRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ReconcileConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(VerifierProperties properties) {
        int size = Math.max(4, properties.effectiveBatchConcurrency() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("verifier-http"));
    }

    @Bean(name = "reconcileWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService reconcileWorkerExecutor(VerifierProperties properties) {
        int size = properties.effectiveBatchConcurrency() * properties.getReconcile().getJobThreads();
        return Executors.newFixedThreadPool(size, namedThreads("reconcile-worker"));
    }

    @Bean(name = "reconcileJobExecutor", destroyMethod = "shutdown")
    public ExecutorService reconcileJobExecutor(VerifierProperties properties) {
        return Executors.newFixedThreadPool(properties.getReconcile().getJobThreads(), namedThreads("reconcile-job"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public BackoffPolicy backoffPolicy(VerifierProperties properties) {
        return BackoffPolicy.from(properties.getRetry());
    }

    @Bean(name = "verificationRateLimiter")
    public TokenBucketRateLimiter verificationRateLimiter(VerifierProperties properties, Clock clock, Sleeper sleeper) {
        VerifierProperties.Verification verification = properties.getVerification();
        return new TokenBucketRateLimiter(
            "verification",
            verification.getRequestsPerWindow(),
            Duration.ofMillis(verification.getWindowMs()),
            clock,
            sleeper
        );
    }

    @Bean(name = "discordRateLimiter")
    public TokenBucketRateLimiter discordRateLimiter(VerifierProperties properties, Clock clock, Sleeper sleeper) {
        VerifierProperties.Discord discord = properties.getDiscord();
        return new TokenBucketRateLimiter(
            "discord",
            discord.getRequestsPerWindow(),
            Duration.ofMillis(discord.getWindowMs()),
            clock,
            sleeper
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
