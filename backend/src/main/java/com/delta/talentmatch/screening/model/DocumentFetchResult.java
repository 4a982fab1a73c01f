package com.delta.talentmatch.screening.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record DocumentFetchResult(
    String reference,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String contentDisposition,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : reference;
    }
}
