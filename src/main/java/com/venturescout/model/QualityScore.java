package com.venturescout.model;

import java.util.List;

/**
 * Intrinsic strength of a candidate. {@code overall} is the weighted blend of the founder
 * average, the company score and team completeness.
 */
public final class QualityScore {
    private static final QualityScore ZERO = new QualityScore(0.0, 0.0, 0.0, 0.0, List.of());

    public final double overall;
    public final double founderAverage;
    public final double companyScore;
    public final double teamCompleteness;
    public final List<FounderQualityScore> founders;

    public QualityScore(
            double overall,
            double founderAverage,
            double companyScore,
            double teamCompleteness,
            List<FounderQualityScore> founders
    ) {
        this.overall = overall;
        this.founderAverage = founderAverage;
        this.companyScore = companyScore;
        this.teamCompleteness = teamCompleteness;
        this.founders = founders == null ? List.of() : List.copyOf(founders);
    }

    public static QualityScore zero() {
        return ZERO;
    }
}
