package com.advisorscout.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTransportError() {
        return errorCode != null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Reason code used in failure counters: the transport error code when present,
     * otherwise {@code http_<status>}.
     */
    public String failureKey() {
        if (errorCode != null) {
            return errorCode;
        }
        if (statusCode > 0) {
            return "http_" + statusCode;
        }
        return "unknown_error";
    }
}
