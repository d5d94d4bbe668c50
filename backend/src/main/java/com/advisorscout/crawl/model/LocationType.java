package com.advisorscout.crawl.model;

public enum LocationType {
    NESTED_SITEMAP,
    PROFILE,
    OTHER
}
