package com.advisorscout.crawl.sitemap;

import com.advisorscout.config.ScoutProperties;
import com.advisorscout.crawl.http.PayloadDecoder;
import com.advisorscout.crawl.http.PoliteHttpClient;
import com.advisorscout.crawl.http.PoliteHttpClientFactory;
import com.advisorscout.crawl.model.HttpFetchResult;
import com.advisorscout.crawl.model.LocationType;
import com.advisorscout.crawl.model.SitemapExpansionResult;
import com.advisorscout.crawl.util.LocationClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expands seed sitemaps into the sorted set of advisor profile URLs they reference, directly
 * or through nested sitemaps. Runs on the caller's thread.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);

    private final PoliteHttpClientFactory clientFactory;
    private final SitemapLocParser locParser;
    private final ScoutProperties properties;

    public SitemapService(
        PoliteHttpClientFactory clientFactory,
        SitemapLocParser locParser,
        ScoutProperties properties
    ) {
        this.clientFactory = clientFactory;
        this.locParser = locParser;
        this.properties = properties;
    }

    public SitemapExpansionResult expand(List<String> seedSitemaps) {
        PoliteHttpClient client = clientFactory.create();
        Set<String> visited = new LinkedHashSet<>();
        TreeSet<String> profileUrls = new TreeSet<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        for (String seed : seedSitemaps) {
            if (seed == null || seed.isBlank()) {
                continue;
            }
            try {
                expandSeed(client, seed.trim(), visited, profileUrls, errors);
            } catch (RuntimeException e) {
                log.warn("Failed to process sitemap {}: {}", seed, e.getMessage(), e);
                increment(errors, "unexpected_error");
            }
        }

        log.info("Total profiles detected: {}", profileUrls.size());
        return new SitemapExpansionResult(List.copyOf(profileUrls), List.copyOf(visited), errors);
    }

    private void expandSeed(
        PoliteHttpClient client,
        String seed,
        Set<String> visited,
        Set<String> profileUrls,
        Map<String, Integer> errors
    ) {
        Deque<String> pending = new ArrayDeque<>();
        pending.push(seed);
        while (!pending.isEmpty()) {
            String sitemapUrl = pending.pop();
            if (!visited.add(sitemapUrl)) {
                continue;
            }

            List<String> locations = fetchLocations(client, sitemapUrl, errors);
            List<String> nested = new ArrayList<>();
            for (String location : locations) {
                LocationType type = LocationClassifier.classify(location, properties.getSitemap().getProfilePathMarker());
                if (type == LocationType.NESTED_SITEMAP) {
                    nested.add(location);
                } else if (type == LocationType.PROFILE) {
                    profileUrls.add(location);
                }
            }
            // Push in reverse so nested sitemaps are expanded in document order.
            for (int i = nested.size() - 1; i >= 0; i--) {
                if (!visited.contains(nested.get(i))) {
                    pending.push(nested.get(i));
                }
            }
        }
    }

    private List<String> fetchLocations(PoliteHttpClient client, String sitemapUrl, Map<String, Integer> errors) {
        log.debug("Fetching sitemap: {}", sitemapUrl);
        HttpFetchResult fetch = client.get(
            sitemapUrl,
            PoliteHttpClient.XML_ACCEPT,
            Duration.ofSeconds(properties.getSitemap().getTimeoutSeconds())
        );
        if (!fetch.isSuccessful()) {
            if (fetch.isTransportError()) {
                log.warn("Network failure fetching sitemap {}: {}", sitemapUrl, fetch.errorMessage());
            } else {
                log.warn("HTTP {} fetching sitemap {}", fetch.statusCode(), sitemapUrl);
            }
            increment(errors, fetch.failureKey());
            return List.of();
        }

        byte[] xmlPayload;
        try {
            xmlPayload = PayloadDecoder.inflate(fetch);
        } catch (IOException e) {
            log.warn("Could not decompress sitemap {}: {}", sitemapUrl, e.getMessage());
            increment(errors, "gzip_decode_error");
            return List.of();
        }

        SitemapLocParser.ParseOutcome outcome = locParser.parse(xmlPayload);
        if (outcome.isMalformed()) {
            log.warn("Could not parse sitemap {}: {}", sitemapUrl, outcome.error());
            increment(errors, "malformed_xml");
            return List.of();
        }
        log.debug("Sitemap {} lists {} locations", sitemapUrl, outcome.locations().size());
        return outcome.locations();
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }
}
