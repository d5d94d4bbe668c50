package com.advisorscout.crawl.model;

import java.util.List;
import java.util.Map;

/**
 * Output of one fetch pipeline run. {@code profiles} is in completion order and holds one
 * entry per URL that was fetched successfully, including profiles without any contact data.
 */
public record PipelineResult(
    List<AdvisorProfile> profiles,
    int processedCount,
    int emptyProfileCount,
    Map<String, Integer> failures
) {
    public int failedCount() {
        return failures.values().stream().mapToInt(Integer::intValue).sum();
    }
}
