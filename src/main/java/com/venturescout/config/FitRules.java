package com.venturescout.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup tables for the fit scorer: industry relations, location regions and the funding
 * stage ladder.
 */
public final class FitRules {
    private static final FitRules DEFAULTS = new FitRules(
            defaultRelatedIndustries(),
            defaultRegions(),
            defaultStages()
    );

    private final Map<String, List<String>> relatedIndustries;
    private final Map<String, List<String>> regions;
    private final Map<String, List<String>> stageKeywords;
    private final Map<String, List<KeywordRule>> stagePatterns;
    private final List<String> stageOrder;

    public FitRules(
            Map<String, List<String>> relatedIndustries,
            Map<String, List<String>> regions,
            Map<String, List<String>> stageKeywords
    ) {
        this.relatedIndustries = copy(relatedIndustries);
        this.regions = copy(regions);
        this.stageKeywords = copy(stageKeywords);
        this.stageOrder = List.copyOf(this.stageKeywords.keySet());
        Map<String, List<KeywordRule>> patterns = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> stage : this.stageKeywords.entrySet()) {
            List<KeywordRule> rules = new ArrayList<>();
            for (String keyword : stage.getValue()) {
                rules.add(KeywordRule.of(keyword, 1));
            }
            patterns.put(stage.getKey(), List.copyOf(rules));
        }
        this.stagePatterns = Collections.unmodifiableMap(patterns);
    }

    public static FitRules defaults() {
        return DEFAULTS;
    }

    public List<String> relatedIndustries(String industry) {
        String key = lower(industry);
        return relatedIndustries.getOrDefault(key, List.of());
    }

    /**
     * Region containing the location, or empty when the location belongs to no known region.
     */
    public String regionOf(String location) {
        String lower = lower(location);
        if (lower.isEmpty()) {
            return "";
        }
        for (Map.Entry<String, List<String>> region : regions.entrySet()) {
            for (String city : region.getValue()) {
                if (lower.contains(city)) {
                    return region.getKey();
                }
            }
        }
        return "";
    }

    /**
     * Canonical stage name for a raw label such as "Series A" or "series-a", or empty.
     */
    public String canonicalStage(String raw) {
        String lower = lower(raw).replace('_', '-');
        if (lower.isEmpty()) {
            return "";
        }
        String dashed = lower.replaceAll("\\s+", "-");
        if (stageKeywords.containsKey(dashed)) {
            return dashed;
        }
        for (Map.Entry<String, List<String>> stage : stageKeywords.entrySet()) {
            for (String keyword : stage.getValue()) {
                if (lower.equals(keyword)) {
                    return stage.getKey();
                }
            }
        }
        return "";
    }

    /**
     * Stage mentioned in free text. The longest matching keyword wins, so "pre-seed" is not read
     * as "seed"; equal lengths go to the later stage.
     */
    public String inferStage(String description) {
        String lower = lower(description);
        if (lower.isEmpty()) {
            return "";
        }
        String best = "";
        int bestLength = 0;
        for (Map.Entry<String, List<KeywordRule>> stage : stagePatterns.entrySet()) {
            for (KeywordRule rule : stage.getValue()) {
                if (rule.phrase().length() >= bestLength && rule.matches(lower)) {
                    best = stage.getKey();
                    bestLength = rule.phrase().length();
                }
            }
        }
        return best;
    }

    /**
     * Position in the stage ladder, or -1 for an unknown stage.
     */
    public int stageRank(String canonicalStage) {
        return stageOrder.indexOf(canonicalStage == null ? "" : canonicalStage);
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, List<String>> e : source.entrySet()) {
                if (e.getKey() == null) {
                    continue;
                }
                out.put(lower(e.getKey()), e.getValue() == null ? List.of() : List.copyOf(e.getValue()));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static String lower(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, List<String>> defaultRelatedIndustries() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("fintech", List.of("financial services", "banking", "payments", "insurtech"));
        map.put("healthtech", List.of("healthcare", "medical", "biotech", "digital health"));
        map.put("e-commerce", List.of("retail", "marketplace", "online shopping"));
        map.put("saas", List.of("software", "enterprise", "b2b", "cloud"));
        map.put("ai/ml", List.of("artificial intelligence", "machine learning", "data science", "ai"));
        map.put("mobile", List.of("mobile app", "ios", "android", "mobile gaming"));
        return map;
    }

    private static Map<String, List<String>> defaultRegions() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("bay area", List.of("san francisco", "palo alto", "mountain view", "menlo park", "bay area"));
        map.put("new york", List.of("new york", "brooklyn", "manhattan", "nyc"));
        map.put("texas", List.of("austin", "dallas", "houston", "texas"));
        map.put("boston", List.of("boston", "cambridge"));
        return map;
    }

    private static Map<String, List<String>> defaultStages() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("pre-seed", List.of("pre-seed", "pre seed", "preseed"));
        map.put("seed", List.of("seed"));
        map.put("series-a", List.of("series a", "series-a"));
        map.put("series-b", List.of("series b", "series-b"));
        map.put("series-c", List.of("series c", "series-c"));
        map.put("growth", List.of("growth stage", "growth-stage", "late stage"));
        return map;
    }
}
