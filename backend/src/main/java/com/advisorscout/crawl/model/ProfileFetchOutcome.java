package com.advisorscout.crawl.model;

public record ProfileFetchOutcome(
    String url,
    AdvisorProfile profile,
    String failureKey,
    String failureMessage
) {
    public static ProfileFetchOutcome success(String url, AdvisorProfile profile) {
        return new ProfileFetchOutcome(url, profile, null, null);
    }

    public static ProfileFetchOutcome failure(String url, String failureKey, String failureMessage) {
        return new ProfileFetchOutcome(url, null, failureKey, failureMessage);
    }

    public boolean isSuccessful() {
        return profile != null;
    }
}
