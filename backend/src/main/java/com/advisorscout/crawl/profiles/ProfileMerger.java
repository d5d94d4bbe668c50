package com.advisorscout.crawl.profiles;

import com.advisorscout.crawl.model.AdvisorProfile;
import com.advisorscout.crawl.model.ProfileCandidate;

/**
 * First writer wins, per field: a candidate value fills a field only while that field is
 * still empty. The profile URL is never touched.
 */
public final class ProfileMerger {

    private ProfileMerger() {
    }

    public static AdvisorProfile merge(AdvisorProfile base, ProfileCandidate candidate) {
        if (candidate == null) {
            return base;
        }
        return new AdvisorProfile(
            pick(base.name(), candidate.name()),
            pick(base.phone(), candidate.phone()),
            pick(base.phone2(), candidate.phone2()),
            pick(base.zipCode(), candidate.zipCode()),
            pick(base.city(), candidate.city()),
            pick(base.street(), candidate.street()),
            pick(base.email(), candidate.email()),
            base.profileUrl()
        );
    }

    private static String pick(String current, String offered) {
        if (current != null) {
            return current;
        }
        return ProfileCandidate.clean(offered);
    }
}
