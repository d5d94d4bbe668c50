package com.advisorscout.crawl.util;

import com.advisorscout.crawl.model.LocationType;

import java.util.List;
import java.util.Locale;

public final class LocationClassifier {
    private static final List<String> SITEMAP_SUFFIXES = List.of(".xml", ".xml.gz");

    private LocationClassifier() {
    }

    /**
     * Classifies a sitemap {@code loc} value. Sitemap suffixes win over the profile marker, so a
     * profile-looking sitemap file is still expanded rather than fetched as a profile.
     */
    public static LocationType classify(String location, String profilePathMarker) {
        if (location == null || location.isBlank()) {
            return LocationType.OTHER;
        }
        String lowered = location.trim().toLowerCase(Locale.ROOT);
        for (String suffix : SITEMAP_SUFFIXES) {
            if (lowered.endsWith(suffix)) {
                return LocationType.NESTED_SITEMAP;
            }
        }
        if (profilePathMarker != null
            && !profilePathMarker.isBlank()
            && lowered.contains(profilePathMarker.toLowerCase(Locale.ROOT))) {
            return LocationType.PROFILE;
        }
        return LocationType.OTHER;
    }
}
