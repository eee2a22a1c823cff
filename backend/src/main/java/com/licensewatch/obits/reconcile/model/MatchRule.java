package com.licensewatch.obits.reconcile.model;

public enum MatchRule {
    EXACT,
    MIDDLE_NAME,
    NICKNAME,
    MAIDEN_NAME,
    NONE
}
