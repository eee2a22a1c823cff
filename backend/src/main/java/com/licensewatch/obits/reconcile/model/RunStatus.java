package com.licensewatch.obits.reconcile.model;

public enum RunStatus {
    COMPLETED,
    LIMIT_REACHED,
    ABORTED,
    ALREADY_COMPLETED
}
