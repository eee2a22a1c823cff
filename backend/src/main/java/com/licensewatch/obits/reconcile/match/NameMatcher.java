package com.licensewatch.obits.reconcile.match;

import com.licensewatch.obits.reconcile.model.MatchDecision;
import com.licensewatch.obits.reconcile.model.MatchRule;
import com.licensewatch.obits.reconcile.model.NameKey;
import com.licensewatch.obits.reconcile.model.ObituaryNameRecord;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether an obituary name record refers to a license candidate. Comparison is
 * exact on normalized tokens; there is no phonetic or edit-distance fallback and no
 * nickname dictionary. Rules are tried in a fixed order and the first hit sets the reason.
 */
@Component
public class NameMatcher {

    public MatchDecision match(String candidateFirst, String candidateLast, ObituaryNameRecord record) {
        if (record == null) {
            return MatchDecision.noMatch("No name object");
        }
        Set<NameKey> candidateKeys = NameNormalizer.variations(candidateFirst, candidateLast);

        NameKey hit = firstCommon(candidateKeys, NameNormalizer.variations(record.firstName(), record.lastName()));
        if (hit != null) {
            return MatchDecision.matched(MatchRule.EXACT, "Exact match: " + describe(hit));
        }
        if (record.hasMiddleName()) {
            hit = firstCommon(candidateKeys, NameNormalizer.variations(record.middleName(), record.lastName()));
            if (hit != null) {
                return MatchDecision.matched(MatchRule.MIDDLE_NAME, "Middle name match: " + describe(hit));
            }
        }
        if (record.hasNickName()) {
            hit = firstCommon(candidateKeys, NameNormalizer.variations(record.nickName(), record.lastName()));
            if (hit != null) {
                return MatchDecision.matched(MatchRule.NICKNAME, "Nickname match: " + describe(hit));
            }
        }
        if (record.hasMaidenName()) {
            hit = firstCommon(candidateKeys, NameNormalizer.variations(record.firstName(), record.maidenName()));
            if (hit != null) {
                return MatchDecision.matched(MatchRule.MAIDEN_NAME, "Maiden name match: " + describe(hit));
            }
        }
        return MatchDecision.noMatch(
            "No match found. License: " + candidateFirst + " " + candidateLast
                + ", Obit: " + nullToEmpty(record.firstName()) + " " + nullToEmpty(record.lastName())
        );
    }

    private NameKey firstCommon(Set<NameKey> candidateKeys, Set<NameKey> recordKeys) {
        for (NameKey key : candidateKeys) {
            // a blank first or last name never confirms identity
            if (key.first().isEmpty() || key.last().isEmpty()) {
                continue;
            }
            if (recordKeys.contains(key)) {
                return key;
            }
        }
        return null;
    }

    private static String describe(NameKey key) {
        return key.first() + " " + key.last();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
