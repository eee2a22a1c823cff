package com.licensewatch.obits.reconcile.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PartitionedRow(boolean kept, String reason, int sourceIndex, Map<String, String> values) {
    public PartitionedRow {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
