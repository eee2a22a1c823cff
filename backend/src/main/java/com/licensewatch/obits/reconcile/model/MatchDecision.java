package com.licensewatch.obits.reconcile.model;

/**
 * Outcome of comparing one candidate with one obituary name. {@code reason} is for audit
 * output only.
 */
public record MatchDecision(boolean isMatch, MatchRule rule, String reason) {
    public static MatchDecision matched(MatchRule rule, String reason) {
        return new MatchDecision(true, rule, reason);
    }

    public static MatchDecision noMatch(String reason) {
        return new MatchDecision(false, MatchRule.NONE, reason);
    }
}
