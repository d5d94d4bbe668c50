package com.advisorscout.config;

import com.advisorscout.crawl.model.DelayRange;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scout")
public class ScoutProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/124.0.0.0 Safari/537.36";
    private static final String DEFAULT_ACCEPT_LANGUAGE = "es-ES,es;q=0.9,en;q=0.8";

    private String userAgent;
    private String acceptLanguage = DEFAULT_ACCEPT_LANGUAGE;
    private int connectTimeoutSeconds = 20;
    private int pageTimeoutSeconds = 60;
    private Sitemap sitemap = new Sitemap();
    private Fetch fetch = new Fetch();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getAcceptLanguage() {
        return acceptLanguage == null || acceptLanguage.isBlank() ? DEFAULT_ACCEPT_LANGUAGE : acceptLanguage.trim();
    }

    public void setAcceptLanguage(String acceptLanguage) {
        this.acceptLanguage = acceptLanguage;
    }

    public int getConnectTimeoutSeconds() {
        return Math.max(1, connectTimeoutSeconds);
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
    }

    public int getPageTimeoutSeconds() {
        return Math.max(1, pageTimeoutSeconds);
    }

    public void setPageTimeoutSeconds(int pageTimeoutSeconds) {
        this.pageTimeoutSeconds = Math.max(1, pageTimeoutSeconds);
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Rejects settings that would make a run meaningless. Called before any network activity.
     *
     * @throws IllegalStateException describing the first inconsistent setting
     */
    public void validate() {
        if (sitemap.getSeeds().isEmpty()) {
            throw new IllegalStateException("At least one seed sitemap is required (scout.sitemap.seeds)");
        }
        if (fetch.getMaxWorkers() < 1) {
            throw new IllegalStateException("scout.fetch.max-workers must be at least 1, got " + fetch.getMaxWorkers());
        }
        if (!Double.isFinite(fetch.getMinDelaySeconds()) || !Double.isFinite(fetch.getMaxDelaySeconds())) {
            throw new IllegalStateException(
                "scout.fetch delays must be finite numbers, got min-delay-seconds=" + fetch.getMinDelaySeconds()
                    + " and max-delay-seconds=" + fetch.getMaxDelaySeconds()
            );
        }
        if (fetch.getMinDelaySeconds() < 0 || fetch.getMaxDelaySeconds() < 0) {
            throw new IllegalStateException("scout.fetch delays must not be negative");
        }
        if (fetch.getMinDelaySeconds() > fetch.getMaxDelaySeconds()) {
            throw new IllegalStateException(
                "scout.fetch.min-delay-seconds (" + fetch.getMinDelaySeconds()
                    + ") must not be greater than scout.fetch.max-delay-seconds (" + fetch.getMaxDelaySeconds() + ")"
            );
        }
        if (cli.getLimit() != null && cli.getLimit() < 0) {
            throw new IllegalStateException("scout.cli.limit must not be negative, got " + cli.getLimit());
        }
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Sitemap {
        private List<String> seeds = new ArrayList<>(List.of("https://www.dvag.de/sitemap-index.xml"));
        private String profilePathMarker = "/vermoegensberater/";
        private int timeoutSeconds = 90;

        public List<String> getSeeds() {
            return seeds.stream()
                .filter(seed -> seed != null && !seed.isBlank())
                .map(String::trim)
                .toList();
        }

        public void setSeeds(List<String> seeds) {
            this.seeds = seeds == null ? new ArrayList<>() : new ArrayList<>(seeds);
        }

        public String getProfilePathMarker() {
            return profilePathMarker;
        }

        public void setProfilePathMarker(String profilePathMarker) {
            this.profilePathMarker = profilePathMarker;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Fetch {
        private int maxWorkers = 8;
        private double minDelaySeconds = 0.3;
        private double maxDelaySeconds = 0.8;
        private int progressLogInterval = 100;

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public double getMinDelaySeconds() {
            return minDelaySeconds;
        }

        public void setMinDelaySeconds(double minDelaySeconds) {
            this.minDelaySeconds = minDelaySeconds;
        }

        public double getMaxDelaySeconds() {
            return maxDelaySeconds;
        }

        public void setMaxDelaySeconds(double maxDelaySeconds) {
            this.maxDelaySeconds = maxDelaySeconds;
        }

        public int getProgressLogInterval() {
            return Math.max(1, progressLogInterval);
        }

        public void setProgressLogInterval(int progressLogInterval) {
            this.progressLogInterval = Math.max(1, progressLogInterval);
        }

        public DelayRange delayRange() {
            return new DelayRange(minDelaySeconds, maxDelaySeconds);
        }
    }

    public static class Cli {
        private boolean run;
        private Integer limit;
        private String output = "dvag_vermoegensberater.csv";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
