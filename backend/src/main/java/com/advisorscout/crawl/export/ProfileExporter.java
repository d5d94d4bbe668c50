package com.advisorscout.crawl.export;

import com.advisorscout.crawl.model.AdvisorProfile;

import java.nio.file.Path;
import java.util.List;

public interface ProfileExporter {

    /**
     * Writes {@code profiles} to {@code output} in the given order, one row per profile with
     * the columns of {@link AdvisorProfile#COLUMNS}.
     */
    void export(List<AdvisorProfile> profiles, Path output);
}
