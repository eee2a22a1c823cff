package com.licensewatch.obits.reconcile.model;

public record RunSummary(
    String inputPath,
    RunStatus status,
    int batchesCompleted,
    int rowsProcessed,
    int keptCount,
    int removedCount,
    ProgressState progress,
    String error
) {
    public boolean isAborted() {
        return status == RunStatus.ABORTED;
    }
}
