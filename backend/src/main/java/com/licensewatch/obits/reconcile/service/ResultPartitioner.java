package com.licensewatch.obits.reconcile.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensewatch.obits.reconcile.match.NameMatcher;
import com.licensewatch.obits.reconcile.model.Candidate;
import com.licensewatch.obits.reconcile.model.MatchDecision;
import com.licensewatch.obits.reconcile.model.ObituaryAuditEntry;
import com.licensewatch.obits.reconcile.model.ObituaryEntry;
import com.licensewatch.obits.reconcile.model.PartitionedRow;
import com.licensewatch.obits.reconcile.model.SearchOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ResultPartitioner {
    public static final String COLUMN_MATCHED_OBITUARIES = "matched_obituaries";
    public static final String COLUMN_TOTAL_MATCHES = "total_matches";
    public static final String COLUMN_TOTAL_FOUND = "total_obituaries_found";
    public static final String COLUMN_REMOVAL_REASON = "removal_reason";

    public static final List<String> KEPT_COLUMNS = List.of(
        COLUMN_MATCHED_OBITUARIES, COLUMN_TOTAL_MATCHES, COLUMN_TOTAL_FOUND
    );
    public static final List<String> REMOVED_COLUMNS = List.of(
        COLUMN_REMOVAL_REASON, COLUMN_MATCHED_OBITUARIES, COLUMN_TOTAL_FOUND
    );

    public static final String REASON_NO_RESULTS = "no results";
    public static final String REASON_NO_MATCHING_NAME = "no matching name";
    public static final String REASON_MATCHED = "matched";

    private final NameMatcher nameMatcher;
    private final ObjectMapper objectMapper;

    public ResultPartitioner(NameMatcher nameMatcher, ObjectMapper objectMapper) {
        this.nameMatcher = nameMatcher;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs every returned entry through the matcher, keeping the remote order within the
     * matched and unmatched lists.
     */
    public SearchOutcome evaluate(Candidate candidate, List<ObituaryEntry> entries) {
        List<ObituaryAuditEntry> matched = new ArrayList<>();
        List<ObituaryAuditEntry> unmatched = new ArrayList<>();
        for (ObituaryEntry entry : entries) {
            MatchDecision decision = nameMatcher.match(candidate.firstName(), candidate.lastName(), entry.name());
            ObituaryAuditEntry audit = ObituaryAuditEntry.of(entry, decision);
            if (decision.isMatch()) {
                matched.add(audit);
            } else {
                unmatched.add(audit);
            }
        }
        return new SearchOutcome(candidate, entries, matched, unmatched);
    }

    public PartitionedRow partition(SearchOutcome outcome) {
        Candidate candidate = outcome.candidate();
        Map<String, String> values = new LinkedHashMap<>(candidate.rawRow());
        int totalFound = outcome.entries().size();

        if (outcome.hasMatches()) {
            values.put(COLUMN_MATCHED_OBITUARIES, toJson(outcome.matched()));
            values.put(COLUMN_TOTAL_MATCHES, Integer.toString(outcome.matched().size()));
            values.put(COLUMN_TOTAL_FOUND, Integer.toString(totalFound));
            return new PartitionedRow(true, REASON_MATCHED, candidate.sourceIndex(), values);
        }

        String reason = totalFound == 0 ? REASON_NO_RESULTS : REASON_NO_MATCHING_NAME;
        values.put(COLUMN_REMOVAL_REASON, reason);
        values.put(COLUMN_MATCHED_OBITUARIES, toJson(outcome.unmatched()));
        values.put(COLUMN_TOTAL_FOUND, Integer.toString(totalFound));
        return new PartitionedRow(false, reason, candidate.sourceIndex(), values);
    }

    private String toJson(List<ObituaryAuditEntry> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize obituary entries", e);
        }
    }
}
