package com.licensewatch.obits.reconcile.model;

public record NameKey(String first, String last) {
    public NameKey {
        first = first == null ? "" : first;
        last = last == null ? "" : last;
    }
}
