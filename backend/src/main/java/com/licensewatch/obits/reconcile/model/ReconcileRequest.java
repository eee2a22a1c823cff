package com.licensewatch.obits.reconcile.model;

/**
 * Everything one run needs from the caller: which file to read, where the two output
 * streams go, and whether existing output is appended to or replaced.
 */
public record ReconcileRequest(
    String inputPath,
    String keptPath,
    String removedPath,
    boolean append
) {}
