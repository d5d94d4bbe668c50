package com.advisorscout.crawl.service;

import com.advisorscout.crawl.export.ProfileExporter;
import com.advisorscout.crawl.model.AdvisorProfile;
import com.advisorscout.crawl.model.PipelineResult;
import com.advisorscout.crawl.model.ScoutRunRequest;
import com.advisorscout.crawl.model.ScoutRunSummary;
import com.advisorscout.crawl.model.SitemapExpansionResult;
import com.advisorscout.crawl.sitemap.SitemapService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ScoutRunService {
    private static final Logger log = LoggerFactory.getLogger(ScoutRunService.class);

    private final SitemapService sitemapService;
    private final ProfileFetchPipeline fetchPipeline;
    private final ProfileExporter exporter;

    public ScoutRunService(
        SitemapService sitemapService,
        ProfileFetchPipeline fetchPipeline,
        ProfileExporter exporter
    ) {
        this.sitemapService = sitemapService;
        this.fetchPipeline = fetchPipeline;
        this.exporter = exporter;
    }

    public ScoutRunSummary run(ScoutRunRequest request) {
        Instant startedAt = Instant.now();
        log.info("Seed sitemaps: {}", String.join(", ", request.sitemaps()));

        SitemapExpansionResult expansion = sitemapService.expand(request.sitemaps());
        Map<String, Integer> errors = new LinkedHashMap<>();
        expansion.errors().forEach((key, value) -> errors.merge("sitemap_" + key, value, Integer::sum));

        List<String> profileUrls = expansion.profileUrls();
        if (request.limit() != null && request.limit() < profileUrls.size()) {
            profileUrls = profileUrls.subList(0, request.limit());
            log.info("Processing only {} profiles due to the configured limit", profileUrls.size());
        }

        if (profileUrls.isEmpty()) {
            log.error("No profile URLs were discovered. Check the seed sitemaps.");
            return summary(ScoutRunSummary.NO_PROFILE_URLS, startedAt, expansion, 0, null, errors, null);
        }

        log.info("Fetching {} profiles with {} workers", profileUrls.size(), request.maxWorkers());
        PipelineResult result = fetchPipeline.fetchAll(profileUrls, request.maxWorkers(), request.delayRange());
        result.failures().forEach((key, value) -> errors.merge("profile_" + key, value, Integer::sum));
        log.info(
            "Fetched {} profiles ({} without contact data), {} failed",
            result.profiles().size(),
            result.emptyProfileCount(),
            result.failedCount()
        );

        if (result.profiles().isEmpty()) {
            log.error("No profile could be fetched. Check the logs for details.");
            return summary(ScoutRunSummary.NO_PROFILES, startedAt, expansion, profileUrls.size(), result, errors, null);
        }

        List<AdvisorProfile> ordered = result.profiles().stream()
            .sorted(Comparator.comparing(AdvisorProfile::profileUrl))
            .toList();
        exporter.export(ordered, request.output());
        return summary(
            ScoutRunSummary.COMPLETED,
            startedAt,
            expansion,
            profileUrls.size(),
            result,
            errors,
            request.output()
        );
    }

    private ScoutRunSummary summary(
        String status,
        Instant startedAt,
        SitemapExpansionResult expansion,
        int processed,
        PipelineResult result,
        Map<String, Integer> errors,
        Path output
    ) {
        return new ScoutRunSummary(
            status,
            startedAt,
            Instant.now(),
            expansion.visitedSitemaps().size(),
            expansion.profileUrls().size(),
            processed,
            result == null ? 0 : result.profiles().size(),
            result == null ? 0 : result.emptyProfileCount(),
            errors,
            output
        );
    }
}
