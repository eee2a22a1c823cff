package com.licensewatch.obits.reconcile.model;

/**
 * Failures that mean the remote side has flagged the whole session, not a single request.
 */
public enum FetchFailureKind {
    BLOCKED,
    RATE_LIMITED
}
