package com.licensewatch.obits.reconcile.model;

import java.time.Duration;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
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
}
