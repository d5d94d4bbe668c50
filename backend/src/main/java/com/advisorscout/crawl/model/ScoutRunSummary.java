package com.advisorscout.crawl.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

public record ScoutRunSummary(
    String status,
    Instant startedAt,
    Instant finishedAt,
    int sitemapsVisited,
    int profileUrlsDiscovered,
    int profileUrlsProcessed,
    int profilesExtracted,
    int emptyProfiles,
    Map<String, Integer> errors,
    Path output
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String NO_PROFILE_URLS = "NO_PROFILE_URLS";
    public static final String NO_PROFILES = "NO_PROFILES";

    public boolean isCompleted() {
        return COMPLETED.equals(status);
    }
}
