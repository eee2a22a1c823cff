package com.licensewatch.obits.reconcile.model;

import java.util.List;

public record LicenseFile(String path, List<String> headers, List<Candidate> candidates) {
    public LicenseFile {
        headers = headers == null ? List.of() : List.copyOf(headers);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
