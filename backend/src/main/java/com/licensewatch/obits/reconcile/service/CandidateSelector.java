package com.licensewatch.obits.reconcile.service;

import com.licensewatch.obits.reconcile.model.Candidate;
import com.licensewatch.obits.reconcile.model.ProgressState;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Pure row selection: which license rows are worth a search, and which of those are still
 * ahead of the checkpoint.
 */
public final class CandidateSelector {
    public static final String EXPIRATION_DATE = "Expiration Date";
    private static final int MIN_NAME_LENGTH = 2;

    private CandidateSelector() {}

    public static List<Candidate> eligible(List<Candidate> rows, int minExpirationYear) {
        List<Candidate> out = new ArrayList<>();
        for (Candidate row : rows) {
            if (isEligible(row, minExpirationYear)) {
                out.add(row);
            }
        }
        return out;
    }

    public static List<Candidate> resumable(List<Candidate> rows, ProgressState progress) {
        int from = progress == null ? 0 : progress.lastProcessedIndex();
        List<Candidate> out = new ArrayList<>();
        for (Candidate row : rows) {
            if (row.sourceIndex() >= from) {
                out.add(row);
            }
        }
        return out;
    }

    public static List<Candidate> toProcess(List<Candidate> rows, ProgressState progress, int minExpirationYear) {
        return resumable(eligible(rows, minExpirationYear), progress);
    }

    static boolean isEligible(Candidate row, int minExpirationYear) {
        OptionalInt year = expirationYear(row.rawRow().get(EXPIRATION_DATE));
        if (year.isEmpty() || year.getAsInt() <= minExpirationYear) {
            return false;
        }
        return row.firstName().length() >= MIN_NAME_LENGTH && row.lastName().length() >= MIN_NAME_LENGTH;
    }

    /**
     * Year of an {@code MM/DD/YYYY} or {@code YYYY-MM-DD} date; empty for anything else.
     */
    public static OptionalInt expirationYear(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalInt.empty();
        }
        String value = raw.trim();
        String yearPart;
        if (value.contains("/")) {
            String[] parts = value.split("/");
            if (parts.length == 0) {
                return OptionalInt.empty();
            }
            yearPart = parts[parts.length - 1];
        } else if (value.contains("-")) {
            String[] parts = value.split("-");
            if (parts.length == 0) {
                return OptionalInt.empty();
            }
            yearPart = parts[0].trim().length() == 4 ? parts[0] : parts[parts.length - 1];
        } else {
            return OptionalInt.empty();
        }
        if (yearPart.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(yearPart.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
