package com.licensewatch.obits.reconcile.service;

/**
 * Stops a reconcile run after the last fully written batch.
 */
public class RunAbortedException extends RuntimeException {
    public RunAbortedException(String message) {
        super(message);
    }
}
