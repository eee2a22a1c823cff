package com.licensewatch.obits.reconcile.match;

import com.licensewatch.obits.reconcile.model.NameKey;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces person names to comparison keys. License rows and obituary records go through
 * the same folding: accents removed, lower case, titles and suffixes dropped.
 */
public final class NameNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[.\\s-]+");
    private static final Set<String> HONORIFICS = Set.of("dr", "mr", "mrs", "ms", "miss");
    private static final Set<String> SUFFIXES = Set.of("jr", "sr", "ii", "iii", "iv", "v", "md", "phd", "rn", "np", "pa");

    private NameNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(raw, Normalizer.Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lower = stripped.toLowerCase(Locale.ROOT).trim();

        List<String> kept = new ArrayList<>();
        for (String token : SEPARATORS.split(lower)) {
            if (token.isEmpty() || HONORIFICS.contains(token) || SUFFIXES.contains(token)) {
                continue;
            }
            kept.add(token);
        }
        return String.join(" ", kept);
    }

    /**
     * Ordered, de-duplicated comparison keys for a name pair. Hyphenated names contribute
     * each segment on its own and the whole name with the hyphen read as a space.
     */
    public static Set<NameKey> variations(String first, String last) {
        String normFirst = normalize(first);
        String normLast = normalize(last);
        boolean hyphenFirst = first != null && first.indexOf('-') >= 0;
        boolean hyphenLast = last != null && last.indexOf('-') >= 0;

        Set<NameKey> variations = new LinkedHashSet<>();
        variations.add(new NameKey(normFirst, normLast));

        if (hyphenFirst) {
            for (String segment : hyphenSegments(first)) {
                variations.add(new NameKey(segment, normLast));
            }
            variations.add(new NameKey(normalize(first.replace('-', ' ')), normLast));
        }
        if (hyphenLast) {
            for (String segment : hyphenSegments(last)) {
                variations.add(new NameKey(normFirst, segment));
            }
            variations.add(new NameKey(normFirst, normalize(last.replace('-', ' '))));
        }
        if (hyphenFirst && hyphenLast) {
            List<String> lastSegments = hyphenSegments(last);
            for (String firstSegment : hyphenSegments(first)) {
                for (String lastSegment : lastSegments) {
                    variations.add(new NameKey(firstSegment, lastSegment));
                }
            }
        }
        return variations;
    }

    private static List<String> hyphenSegments(String name) {
        List<String> segments = new ArrayList<>();
        for (String part : name.split("-")) {
            String normalized = normalize(part);
            if (!normalized.isEmpty()) {
                segments.add(normalized);
            }
        }
        return segments;
    }
}
