package com.venturescout.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable keyword → points table. Every scorer evaluates its tables through the same two
 * operations, so a table can be swapped from configuration without touching scorer code.
 */
public final class RuleTable {
    private static final RuleTable EMPTY = new RuleTable(List.of());

    private final List<KeywordRule> rules;

    private RuleTable(List<KeywordRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleTable empty() {
        return EMPTY;
    }

    public static RuleTable uniform(Collection<String> phrases, double points) {
        List<KeywordRule> out = new ArrayList<>();
        if (phrases != null) {
            for (String phrase : phrases) {
                if (phrase != null && !phrase.isBlank()) {
                    out.add(KeywordRule.of(phrase, points));
                }
            }
        }
        return new RuleTable(out);
    }

    public static RuleTable weighted(Map<String, ? extends Number> phrasePoints) {
        List<KeywordRule> out = new ArrayList<>();
        if (phrasePoints != null) {
            for (Map.Entry<String, ? extends Number> e : phrasePoints.entrySet()) {
                if (e.getKey() != null && !e.getKey().isBlank() && e.getValue() != null) {
                    out.add(KeywordRule.of(e.getKey(), e.getValue().doubleValue()));
                }
            }
        }
        return new RuleTable(out);
    }

    /**
     * Parse {@code phrase:points} entries. Entries without a points suffix, or with an unreadable
     * one, are worth {@code defaultPoints}.
     */
    public static RuleTable parse(List<String> entries, double defaultPoints) {
        Map<String, Double> parsed = new LinkedHashMap<>();
        if (entries != null) {
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                int idx = entry.lastIndexOf(':');
                String phrase = idx > 0 ? entry.substring(0, idx) : entry;
                double points = defaultPoints;
                if (idx > 0) {
                    try {
                        points = Double.parseDouble(entry.substring(idx + 1).trim());
                    } catch (NumberFormatException e) {
                        phrase = entry;
                    }
                }
                if (!phrase.isBlank()) {
                    parsed.put(phrase.trim(), points);
                }
            }
        }
        return weighted(parsed);
    }

    /**
     * Sum of points over every rule that matches.
     */
    public double sum(String text) {
        String lower = lower(text);
        double total = 0.0;
        for (KeywordRule rule : rules) {
            if (rule.matches(lower)) {
                total += rule.points();
            }
        }
        return total;
    }

    public boolean anyMatch(String text) {
        String lower = lower(text);
        for (KeywordRule rule : rules) {
            if (rule.matches(lower)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
