package com.rolesync.verifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "verifier")
public class VerifierProperties {
    private static final String DEFAULT_DISCORD_BASE_URL = "https://discord.com/api/v10";

    private Verification verification = new Verification();
    private Discord discord = new Discord();
    private Retry retry = new Retry();
    private Reconcile reconcile = new Reconcile();

    public Verification getVerification() {
        return verification;
    }

    public void setVerification(Verification verification) {
        this.verification = verification;
    }

    public Discord getDiscord() {
        return discord;
    }

    public void setDiscord(Discord discord) {
        this.discord = discord;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public void setReconcile(Reconcile reconcile) {
        this.reconcile = reconcile;
    }

    /**
     * Worker count for one batch job. Kept below the smaller of the two request quotas so a
     * running batch never holds every token of either limiter.
     */
    public int effectiveBatchConcurrency() {
        int quota = Math.min(verification.getRequestsPerWindow(), discord.getRequestsPerWindow());
        int ceiling = Math.max(1, quota - 1);
        return Math.max(1, Math.min(reconcile.getBatchConcurrency(), ceiling));
    }

    public static String normalizeBaseUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return "";
        }
        String value = candidate.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public static class Verification {
        private String baseUrl;
        private String apiKey;
        private int requestTimeoutSeconds = 10;
        private int requestsPerWindow = 20;
        private int windowMs = 1000;
        private int slowLookupWarnMs = 400;

        public String getBaseUrl() {
            return normalizeBaseUrl(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getRequestsPerWindow() {
            return Math.max(1, requestsPerWindow);
        }

        public void setRequestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = Math.max(1, requestsPerWindow);
        }

        public int getWindowMs() {
            return Math.max(1, windowMs);
        }

        public void setWindowMs(int windowMs) {
            this.windowMs = Math.max(1, windowMs);
        }

        public int getSlowLookupWarnMs() {
            return slowLookupWarnMs;
        }

        public void setSlowLookupWarnMs(int slowLookupWarnMs) {
            this.slowLookupWarnMs = slowLookupWarnMs;
        }
    }

    public static class Discord {
        private String baseUrl = DEFAULT_DISCORD_BASE_URL;
        private String botToken;
        private int requestTimeoutSeconds = 10;
        private int requestsPerWindow = 40;
        private int windowMs = 1000;
        private int maxRateLimitRetries = 3;
        private int memberPageSize = 1000;
        private String auditLogReason = "Verification status sync";

        public String getBaseUrl() {
            String normalized = normalizeBaseUrl(baseUrl);
            return normalized.isEmpty() ? DEFAULT_DISCORD_BASE_URL : normalized;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBotToken() {
            return botToken == null ? "" : botToken.trim();
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getRequestsPerWindow() {
            return Math.max(1, requestsPerWindow);
        }

        public void setRequestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = Math.max(1, requestsPerWindow);
        }

        public int getWindowMs() {
            return Math.max(1, windowMs);
        }

        public void setWindowMs(int windowMs) {
            this.windowMs = Math.max(1, windowMs);
        }

        public int getMaxRateLimitRetries() {
            return Math.max(0, maxRateLimitRetries);
        }

        public void setMaxRateLimitRetries(int maxRateLimitRetries) {
            this.maxRateLimitRetries = Math.max(0, maxRateLimitRetries);
        }

        public int getMemberPageSize() {
            return Math.max(1, Math.min(1000, memberPageSize));
        }

        public void setMemberPageSize(int memberPageSize) {
            this.memberPageSize = memberPageSize;
        }

        public String getAuditLogReason() {
            return auditLogReason;
        }

        public void setAuditLogReason(String auditLogReason) {
            this.auditLogReason = auditLogReason;
        }
    }

    public static class Retry {
        private int baseDelayMs = 250;
        private double multiplier = 2.0;
        private int maxDelayMs = 4000;
        private int maxAttempts = 4;

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public double getMultiplier() {
            return Math.max(1.0, multiplier);
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = Math.max(1.0, multiplier);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }
    }

    public static class Reconcile {
        private int batchConcurrency = 4;
        private int configRecheckEvery = 100;
        private int reportMaxFailures = 10;
        private int jobThreads = 2;

        public int getBatchConcurrency() {
            return Math.max(1, batchConcurrency);
        }

        public void setBatchConcurrency(int batchConcurrency) {
            this.batchConcurrency = Math.max(1, batchConcurrency);
        }

        public int getConfigRecheckEvery() {
            return Math.max(0, configRecheckEvery);
        }

        public void setConfigRecheckEvery(int configRecheckEvery) {
            this.configRecheckEvery = Math.max(0, configRecheckEvery);
        }

        public int getReportMaxFailures() {
            return Math.max(0, reportMaxFailures);
        }

        public void setReportMaxFailures(int reportMaxFailures) {
            this.reportMaxFailures = Math.max(0, reportMaxFailures);
        }

        public int getJobThreads() {
            return Math.max(1, jobThreads);
        }

        public void setJobThreads(int jobThreads) {
            this.jobThreads = Math.max(1, jobThreads);
        }
    }
}
