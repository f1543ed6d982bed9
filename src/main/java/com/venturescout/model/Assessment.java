package com.venturescout.model;

import java.util.List;

/**
 * Label and narrative attached to a scored candidate.
 */
public record Assessment(
        Recommendation recommendation,
        List<String> pros,
        List<String> cons
) {
    public Assessment {
        recommendation = recommendation == null ? Recommendation.WEAK_MATCH : recommendation;
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
    }
}
