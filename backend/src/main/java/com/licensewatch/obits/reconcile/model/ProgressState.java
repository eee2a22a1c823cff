package com.licensewatch.obits.reconcile.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Checkpoint for one input file. Instances are immutable; each {@code with*} call returns
 * the next state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    "last_processed_index", "timestamp", "file_path", "total_found", "total_processed", "completed", "error"
})
public record ProgressState(
    @JsonProperty("last_processed_index") int lastProcessedIndex,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("total_found") int totalFound,
    @JsonProperty("total_processed") int totalProcessed,
    @JsonProperty("completed") boolean completed,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String lastError
) {
    public ProgressState {
        lastProcessedIndex = Math.max(0, lastProcessedIndex);
        totalProcessed = Math.max(0, totalProcessed);
        totalFound = Math.max(0, Math.min(totalFound, totalProcessed));
    }

    public static ProgressState initial(String filePath) {
        return new ProgressState(0, null, filePath, 0, 0, false, null);
    }

    public ProgressState withBatchCompleted(int lastIndex, int found, int processed, Instant now) {
        return new ProgressState(
            Math.max(lastProcessedIndex, lastIndex),
            now,
            filePath,
            totalFound + found,
            totalProcessed + processed,
            false,
            null
        );
    }

    public ProgressState withError(String error, Instant now) {
        return new ProgressState(lastProcessedIndex, now, filePath, totalFound, totalProcessed, false, error);
    }

    public ProgressState withCompleted(Instant now) {
        return new ProgressState(lastProcessedIndex, now, filePath, totalFound, totalProcessed, true, null);
    }
}
