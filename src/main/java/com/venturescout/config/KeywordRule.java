package com.venturescout.config;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One phrase and the points it is worth. Phrases match on word boundaries, so "lead" does not
 * match "leadership" and "mit" does not match "summit".
 */
public record KeywordRule(String phrase, double points, Pattern pattern) {

    public static KeywordRule of(String phrase, double points) {
        String normalized = phrase == null ? "" : phrase.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("keyword rule phrase must not be blank");
        }
        Pattern pattern = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(normalized) + "(?![a-z0-9])");
        return new KeywordRule(normalized, points, pattern);
    }

    /**
     * @param lowerText text already lower-cased by the caller
     */
    public boolean matches(String lowerText) {
        return lowerText != null && !lowerText.isEmpty() && pattern.matcher(lowerText).find();
    }
}
