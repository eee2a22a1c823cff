package com.licensewatch.obits.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/138.0.0.0 Safari/537.36";

    private List<String> inputs = new ArrayList<>();
    private String userAgent;
    private String referer = "https://www.legacy.com/obituaries/search";
    private int concurrency = 2;
    private int requestTimeoutSeconds = 30;
    private Search search = new Search();
    private Fetch fetch = new Fetch();
    private Batch batch = new Batch();
    private Eligibility eligibility = new Eligibility();
    private Checkpoint checkpoint = new Checkpoint();
    private Output output = new Output();
    private Cli cli = new Cli();

    public List<String> getInputs() {
        return inputs;
    }

    public void setInputs(List<String> inputs) {
        this.inputs = inputs == null ? new ArrayList<>() : new ArrayList<>(inputs);
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getReferer() {
        return referer;
    }

    public void setReferer(String referer) {
        this.referer = referer;
    }

    public int getConcurrency() {
        return Math.max(1, concurrency);
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Eligibility getEligibility() {
        return eligibility;
    }

    public void setEligibility(Eligibility eligibility) {
        this.eligibility = eligibility;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Search {
        private String baseUrl = "https://www.legacy.com/api/_frontend/search";
        private String countryId = "1";
        private String regionId = "41";
        private String startDate = "01-01-2023";
        private String endDate = "12-01-2025";
        private int limit = 50;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCountryId() {
            return countryId;
        }

        public void setCountryId(String countryId) {
            this.countryId = countryId;
        }

        public String getRegionId() {
            return regionId;
        }

        public void setRegionId(String regionId) {
            this.regionId = regionId;
        }

        public String getStartDate() {
            return startDate;
        }

        public void setStartDate(String startDate) {
            this.startDate = startDate;
        }

        public String getEndDate() {
            return endDate;
        }

        public void setEndDate(String endDate) {
            this.endDate = endDate;
        }

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }
    }

    public static class Fetch {
        static final int MAX_ATTEMPTS_CEILING = 10;

        private int maxAttempts = 3;
        private int jitterMinMs = 500;
        private int jitterMaxMs = 1500;
        private long rateLimitBackoffBaseMs = 30_000L;
        private long transientRetryDelayMs = 5_000L;

        public int getMaxAttempts() {
            return Math.min(MAX_ATTEMPTS_CEILING, Math.max(1, maxAttempts));
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.min(MAX_ATTEMPTS_CEILING, Math.max(1, maxAttempts));
        }

        public int getJitterMinMs() {
            return Math.max(0, jitterMinMs);
        }

        public void setJitterMinMs(int jitterMinMs) {
            this.jitterMinMs = Math.max(0, jitterMinMs);
        }

        public int getJitterMaxMs() {
            return Math.max(getJitterMinMs(), jitterMaxMs);
        }

        public void setJitterMaxMs(int jitterMaxMs) {
            this.jitterMaxMs = Math.max(0, jitterMaxMs);
        }

        public long getRateLimitBackoffBaseMs() {
            return rateLimitBackoffBaseMs;
        }

        public void setRateLimitBackoffBaseMs(long rateLimitBackoffBaseMs) {
            this.rateLimitBackoffBaseMs = Math.max(0L, rateLimitBackoffBaseMs);
        }

        public long getTransientRetryDelayMs() {
            return transientRetryDelayMs;
        }

        public void setTransientRetryDelayMs(long transientRetryDelayMs) {
            this.transientRetryDelayMs = Math.max(0L, transientRetryDelayMs);
        }
    }

    public static class Batch {
        private int size = 20;
        private long pauseMs = 2_000L;
        private int maxRows = 0;

        public int getSize() {
            return Math.max(1, size);
        }

        public void setSize(int size) {
            this.size = Math.max(1, size);
        }

        public long getPauseMs() {
            return pauseMs;
        }

        public void setPauseMs(long pauseMs) {
            this.pauseMs = Math.max(0L, pauseMs);
        }

        /**
         * Rows to process per invocation; zero means no limit.
         */
        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = Math.max(0, maxRows);
        }
    }

    public static class Eligibility {
        private int minExpirationYear = 2023;

        /**
         * Rows qualify only when their expiration year is strictly greater than this value.
         */
        public int getMinExpirationYear() {
            return minExpirationYear;
        }

        public void setMinExpirationYear(int minExpirationYear) {
            this.minExpirationYear = minExpirationYear;
        }
    }

    public static class Checkpoint {
        private String directory = ".";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory == null || directory.isBlank() ? "." : directory.trim();
        }
    }

    public static class Output {
        private String keptPath = "filtered-possibilities.csv";
        private String removedPath = "removed-possibilities.csv";
        private boolean append = true;

        public String getKeptPath() {
            return keptPath;
        }

        public void setKeptPath(String keptPath) {
            this.keptPath = keptPath;
        }

        public String getRemovedPath() {
            return removedPath;
        }

        public void setRemovedPath(String removedPath) {
            this.removedPath = removedPath;
        }

        public boolean isAppend() {
            return append;
        }

        public void setAppend(boolean append) {
            this.append = append;
        }
    }

    public static class Cli {
        private boolean run;
        private String action = "run";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getAction() {
            return action;
        }

        public void setAction(String action) {
            this.action = action;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
