package com.venturescout.model;

public record FounderQualityScore(
        String name,
        double experience,
        double education,
        double honors,
        double network,
        double titleRelevance,
        double total
) {
    public FounderQualityScore {
        name = name == null ? "" : name;
    }
}
