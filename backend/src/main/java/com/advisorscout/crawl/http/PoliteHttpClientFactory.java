package com.advisorscout.crawl.http;

import com.advisorscout.config.ScoutProperties;
import org.springframework.stereotype.Component;

@Component
public class PoliteHttpClientFactory {
    private final ScoutProperties properties;

    public PoliteHttpClientFactory(ScoutProperties properties) {
        this.properties = properties;
    }

    /** Creates a new session; callers own it exclusively. */
    public PoliteHttpClient create() {
        return new PoliteHttpClient(properties);
    }
}
