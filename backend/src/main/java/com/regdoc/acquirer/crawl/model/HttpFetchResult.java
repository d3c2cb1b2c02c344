package com.regdoc.acquirer.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String identityName,
    DetectionVerdict verdict,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200
            && statusCode < 300
            && errorCode == null
            && (verdict == null || verdict.isNormal());
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
