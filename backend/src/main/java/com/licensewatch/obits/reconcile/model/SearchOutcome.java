package com.licensewatch.obits.reconcile.model;

import java.util.List;

public record SearchOutcome(
    Candidate candidate,
    List<ObituaryEntry> entries,
    List<ObituaryAuditEntry> matched,
    List<ObituaryAuditEntry> unmatched
) {
    public SearchOutcome {
        entries = entries == null ? List.of() : List.copyOf(entries);
        matched = matched == null ? List.of() : List.copyOf(matched);
        unmatched = unmatched == null ? List.of() : List.copyOf(unmatched);
    }

    public static SearchOutcome empty(Candidate candidate) {
        return new SearchOutcome(candidate, List.of(), List.of(), List.of());
    }

    public boolean hasMatches() {
        return !matched.isEmpty();
    }
}
