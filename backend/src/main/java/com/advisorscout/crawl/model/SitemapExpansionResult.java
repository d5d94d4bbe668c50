package com.advisorscout.crawl.model;

import java.util.List;
import java.util.Map;

public record SitemapExpansionResult(
    List<String> profileUrls,
    List<String> visitedSitemaps,
    Map<String, Integer> errors
) {
}
