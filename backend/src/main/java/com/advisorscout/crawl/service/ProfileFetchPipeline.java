package com.advisorscout.crawl.service;

import com.advisorscout.config.ScoutProperties;
import com.advisorscout.crawl.http.PayloadDecoder;
import com.advisorscout.crawl.http.PoliteHttpClient;
import com.advisorscout.crawl.http.PoliteHttpClientFactory;
import com.advisorscout.crawl.model.AdvisorProfile;
import com.advisorscout.crawl.model.DelayRange;
import com.advisorscout.crawl.model.HttpFetchResult;
import com.advisorscout.crawl.model.PipelineResult;
import com.advisorscout.crawl.model.ProfileFetchOutcome;
import com.advisorscout.crawl.profiles.AdvisorProfileExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches and parses profile pages with a fixed pool of workers. Each worker owns one
 * {@link PoliteHttpClient} for its lifetime and pulls URLs from a shared queue until it is
 * drained. A failed URL yields no profile and never stops the other workers.
 */
@Service
public class ProfileFetchPipeline {
    private static final Logger log = LoggerFactory.getLogger(ProfileFetchPipeline.class);

    private final PoliteHttpClientFactory clientFactory;
    private final AdvisorProfileExtractor extractor;
    private final ScoutProperties properties;

    public ProfileFetchPipeline(
        PoliteHttpClientFactory clientFactory,
        AdvisorProfileExtractor extractor,
        ScoutProperties properties
    ) {
        this.clientFactory = clientFactory;
        this.extractor = extractor;
        this.properties = properties;
    }

    public PipelineResult fetchAll(List<String> urls, int concurrency, DelayRange delayRange) {
        if (urls.isEmpty()) {
            return new PipelineResult(List.of(), 0, 0, Map.of());
        }
        int workerCount = Math.max(1, Math.min(concurrency, urls.size()));
        RunState state = new RunState(urls, newPacer(delayRange));

        ExecutorService executor = Executors.newFixedThreadPool(workerCount, workerThreadFactory());
        List<Future<?>> workers = new ArrayList<>(workerCount);
        try {
            for (int i = 0; i < workerCount; i++) {
                workers.add(executor.submit(() -> runWorker(state)));
            }
            executor.shutdown();
            for (Future<?> worker : workers) {
                try {
                    worker.get();
                } catch (ExecutionException e) {
                    log.warn("Profile fetch worker stopped unexpectedly", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for profile fetch workers; {} URLs left unprocessed", state.pending.size());
        } finally {
            executor.shutdownNow();
        }

        return new PipelineResult(
            List.copyOf(state.profiles),
            state.processed.get(),
            state.empty.get(),
            state.failureCounts()
        );
    }

    private void runWorker(RunState state) {
        PoliteHttpClient client = clientFactory.create();
        String url;
        while ((url = state.pending.poll()) != null) {
            ProfileFetchOutcome outcome;
            try {
                if (!state.pacer.pause(url)) {
                    log.debug("Worker interrupted before requesting {}", url);
                    return;
                }
                outcome = fetchProfile(client, url);
            } catch (RuntimeException e) {
                log.warn("Unhandled error processing {}: {}", url, e.getMessage(), e);
                outcome = ProfileFetchOutcome.failure(url, "unexpected_error", e.getMessage());
            }
            state.record(outcome);

            int processed = state.processed.incrementAndGet();
            if (processed % properties.getFetch().getProgressLogInterval() == 0) {
                log.info("Profiles processed: {}", processed);
            }
        }
    }

    RequestPacer newPacer(DelayRange delayRange) {
        return new RequestPacer(delayRange);
    }

    ProfileFetchOutcome fetchProfile(PoliteHttpClient client, String url) {
        HttpFetchResult fetch = client.get(
            url,
            PoliteHttpClient.HTML_ACCEPT,
            Duration.ofSeconds(properties.getPageTimeoutSeconds())
        );
        if (!fetch.isSuccessful()) {
            if (fetch.isTransportError()) {
                log.warn("Network failure on {}: {}", url, fetch.errorMessage());
            } else {
                log.warn("HTTP error {} on {}", fetch.statusCode(), url);
            }
            return ProfileFetchOutcome.failure(url, fetch.failureKey(), fetch.errorMessage());
        }

        AdvisorProfile profile;
        try {
            profile = extractor.parse(PayloadDecoder.inflate(fetch), PayloadDecoder.declaredCharset(fetch.contentType()), url);
        } catch (IOException e) {
            log.warn("Could not decode body of {}: {}", url, e.getMessage());
            return ProfileFetchOutcome.failure(url, "decode_error", e.getMessage());
        }
        if (!profile.hasContactSignal()) {
            log.debug("Empty profile at {}", url);
        }
        return ProfileFetchOutcome.success(url, profile);
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "profile-fetch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunState {
        private final Queue<String> pending;
        private final RequestPacer pacer;
        private final Queue<AdvisorProfile> profiles = new ConcurrentLinkedQueue<>();
        private final Map<String, AtomicInteger> failures = new ConcurrentHashMap<>();
        private final AtomicInteger processed = new AtomicInteger();
        private final AtomicInteger empty = new AtomicInteger();

        private RunState(List<String> urls, RequestPacer pacer) {
            this.pending = new ConcurrentLinkedQueue<>(urls);
            this.pacer = pacer;
        }

        private void record(ProfileFetchOutcome outcome) {
            if (outcome.isSuccessful()) {
                profiles.add(outcome.profile());
                if (!outcome.profile().hasContactSignal()) {
                    empty.incrementAndGet();
                }
                return;
            }
            failures.computeIfAbsent(outcome.failureKey(), ignored -> new AtomicInteger()).incrementAndGet();
        }

        private Map<String, Integer> failureCounts() {
            Map<String, Integer> counts = new LinkedHashMap<>();
            new TreeMap<>(failures).forEach((key, value) -> counts.put(key, value.get()));
            return counts;
        }
    }
}
