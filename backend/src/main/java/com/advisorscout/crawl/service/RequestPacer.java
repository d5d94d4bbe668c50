package com.advisorscout.crawl.service;

import com.advisorscout.crawl.model.DelayRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered pause taken by a fetch worker before each request, drawn uniformly from the
 * configured range. Disabled when the upper bound is zero.
 */
public class RequestPacer {
    private static final Logger log = LoggerFactory.getLogger(RequestPacer.class);

    private final DelayRange range;

    public RequestPacer(DelayRange range) {
        this.range = range;
    }

    public long nextDelayMillis() {
        if (range.isDisabled()) {
            return 0L;
        }
        double seconds = range.minSeconds() == range.maxSeconds()
            ? range.minSeconds()
            : ThreadLocalRandom.current().nextDouble(range.minSeconds(), range.maxSeconds());
        return Math.round(seconds * 1000d);
    }

    /**
     * Sleeps before fetching {@code url}.
     *
     * @return false if the thread was interrupted while waiting
     */
    public boolean pause(String url) {
        long delayMs = nextDelayMillis();
        if (delayMs <= 0) {
            return true;
        }
        log.debug("Waiting {} ms before requesting {}", delayMs, url);
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
