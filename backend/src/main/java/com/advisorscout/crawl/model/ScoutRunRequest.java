package com.advisorscout.crawl.model;

import java.nio.file.Path;
import java.util.List;

public record ScoutRunRequest(
    List<String> sitemaps,
    Integer limit,
    int maxWorkers,
    DelayRange delayRange,
    Path output
) {
}
