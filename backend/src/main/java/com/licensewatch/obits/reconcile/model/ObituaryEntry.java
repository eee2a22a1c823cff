package com.licensewatch.obits.reconcile.model;

public record ObituaryEntry(String id, ObituaryNameRecord name, String obituaryUrl) {}
