package com.advisorscout.crawl.profiles;

import com.advisorscout.crawl.model.AdvisorProfile;
import com.advisorscout.crawl.model.ProfileCandidate;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileMergerTest {
    private static final String URL = "https://example.com/vermoegensberater/jane";

    private final AdvisorProfile partial =
        new AdvisorProfile("Jane Doe", null, null, "12345", null, "Main St 1", null, URL);

    @Test
    void fillsOnlyEmptyFields() {
        ProfileCandidate candidate =
            new ProfileCandidate("Other Name", "+49 1", "+49 2", "99999", "Berlin", "Other St", "jane@example.com");

        AdvisorProfile merged = ProfileMerger.merge(partial, candidate);

        assertThat(merged).isEqualTo(
            new AdvisorProfile("Jane Doe", "+49 1", "+49 2", "12345", "Berlin", "Main St 1", "jane@example.com", URL)
        );
    }

    @Test
    void blankCandidateValuesDoNotFillFields() {
        ProfileCandidate candidate = new ProfileCandidate(null, "   ", "", null, "\t", null, " ");

        assertThat(ProfileMerger.merge(partial, candidate)).isEqualTo(partial);
    }

    @Test
    void mergingEmptyCandidateOrItselfIsNoOp() {
        assertThat(ProfileMerger.merge(partial, ProfileCandidate.EMPTY)).isEqualTo(partial);
        assertThat(ProfileMerger.merge(partial, partial.asCandidate())).isEqualTo(partial);
        assertThat(ProfileMerger.merge(partial, null)).isSameAs(partial);
    }

    @Test
    void profileUrlIsNeverChanged() {
        AdvisorProfile merged = ProfileMerger.merge(AdvisorProfile.forUrl(URL), partial.asCandidate());

        assertThat(merged.profileUrl()).isEqualTo(URL);
        assertThat(merged.name()).isEqualTo("Jane Doe");
    }

    @Test
    void candidateValuesAreTrimmed() {
        ProfileCandidate candidate = new ProfileCandidate(null, "  +49 1  ", null, null, " Berlin ", null, null);

        AdvisorProfile merged = ProfileMerger.merge(partial, candidate);

        assertThat(merged.phone()).isEqualTo("+49 1");
        assertThat(merged.city()).isEqualTo("Berlin");
    }
}
