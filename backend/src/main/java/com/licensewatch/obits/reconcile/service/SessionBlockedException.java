package com.licensewatch.obits.reconcile.service;

import com.licensewatch.obits.reconcile.model.FetchFailureKind;

/**
 * Raised when the search service has flagged the session; no further request in the run is
 * worth sending.
 */
public class SessionBlockedException extends RunAbortedException {
    private final FetchFailureKind kind;

    public SessionBlockedException(FetchFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchFailureKind getKind() {
        return kind;
    }
}
