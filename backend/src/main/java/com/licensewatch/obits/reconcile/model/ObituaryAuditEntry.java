package com.licensewatch.obits.reconcile.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Serialized form of an obituary entry in the {@code matched_obituaries} output column.
 */
@JsonPropertyOrder({"name", "id", "obituaryUrl", "match_reason", "is_match"})
public record ObituaryAuditEntry(
    ObituaryNameRecord name,
    String id,
    String obituaryUrl,
    @JsonProperty("match_reason") String matchReason,
    @JsonProperty("is_match") boolean isMatch
) {
    public static ObituaryAuditEntry of(ObituaryEntry entry, MatchDecision decision) {
        return new ObituaryAuditEntry(
            entry.name(),
            entry.id(),
            entry.obituaryUrl() == null ? "" : entry.obituaryUrl(),
            decision.reason(),
            decision.isMatch()
        );
    }
}
