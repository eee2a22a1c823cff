package com.licensewatch.obits.reconcile.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One license row. {@code rawRow} keeps the input columns in header order and is written
 * back out untouched.
 */
public record Candidate(
    String firstName,
    String lastName,
    Map<String, String> rawRow,
    int sourceIndex
) {
    public Candidate {
        firstName = firstName == null ? "" : firstName.trim();
        lastName = lastName == null ? "" : lastName.trim();
        rawRow = rawRow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawRow));
    }

    public String displayName() {
        return firstName + " " + lastName;
    }
}
