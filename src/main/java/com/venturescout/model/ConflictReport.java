package com.venturescout.model;

import java.util.List;

/**
 * Overlap between a candidate and the organization's current holdings.
 */
public final class ConflictReport {
    public static final String SEVERITY_NONE = "none";
    public static final String SEVERITY_MEDIUM = "medium";
    public static final String SEVERITY_HIGH = "high";

    private static final ConflictReport NONE = new ConflictReport(0.0, 100.0, List.of(), List.of(), SEVERITY_NONE);

    public final double conflictScore;
    public final double portfolioFitScore;
    public final List<String> conflictingNames;
    public final List<String> industryOverlaps;
    public final String severity;

    public ConflictReport(
            double conflictScore,
            double portfolioFitScore,
            List<String> conflictingNames,
            List<String> industryOverlaps,
            String severity
    ) {
        this.conflictScore = conflictScore;
        this.portfolioFitScore = portfolioFitScore;
        this.conflictingNames = conflictingNames == null ? List.of() : List.copyOf(conflictingNames);
        this.industryOverlaps = industryOverlaps == null ? List.of() : List.copyOf(industryOverlaps);
        this.severity = severity == null || severity.isBlank() ? SEVERITY_NONE : severity;
    }

    public static ConflictReport none() {
        return NONE;
    }

    public boolean hasConflicts() {
        return !conflictingNames.isEmpty();
    }
}
