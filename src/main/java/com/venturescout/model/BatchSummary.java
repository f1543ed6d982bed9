package com.venturescout.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates for one batch. Holds no timings, so the same inputs give the same summary.
 */
public final class BatchSummary {
    public final String organization;
    public final int candidates;
    public final int scored;
    public final int failed;
    public final boolean cancelled;
    public final double averageOverall;
    public final double averageQuality;
    public final double averageFit;
    public final double averagePortfolioFit;
    public final Map<Recommendation, Integer> recommendationCounts;

    public BatchSummary(
            String organization,
            int candidates,
            int scored,
            int failed,
            boolean cancelled,
            double averageOverall,
            double averageQuality,
            double averageFit,
            double averagePortfolioFit,
            Map<Recommendation, Integer> recommendationCounts
    ) {
        this.organization = organization == null ? "" : organization;
        this.candidates = Math.max(0, candidates);
        this.scored = Math.max(0, scored);
        this.failed = Math.max(0, failed);
        this.cancelled = cancelled;
        this.averageOverall = averageOverall;
        this.averageQuality = averageQuality;
        this.averageFit = averageFit;
        this.averagePortfolioFit = averagePortfolioFit;
        Map<Recommendation, Integer> counts = new EnumMap<>(Recommendation.class);
        for (Recommendation r : Recommendation.values()) {
            counts.put(r, 0);
        }
        if (recommendationCounts != null) {
            counts.putAll(recommendationCounts);
        }
        this.recommendationCounts = Collections.unmodifiableMap(counts);
    }

    public static BatchSummary of(String organization, int candidates, List<ScoreBreakdown> ranked, boolean cancelled) {
        List<ScoreBreakdown> rows = ranked == null ? List.of() : ranked;
        int failed = 0;
        double overall = 0.0;
        double quality = 0.0;
        double fit = 0.0;
        double portfolio = 0.0;
        Map<Recommendation, Integer> counts = new EnumMap<>(Recommendation.class);
        for (ScoreBreakdown row : rows) {
            if (row.isFailed()) {
                failed++;
            }
            overall += row.overallScore;
            quality += row.qualityScore;
            fit += row.fitScore;
            portfolio += row.portfolioFitScore;
            counts.merge(row.recommendation, 1, Integer::sum);
        }
        int n = rows.size();
        return new BatchSummary(
                organization,
                candidates,
                n - failed,
                failed,
                cancelled,
                avg(overall, n),
                avg(quality, n),
                avg(fit, n),
                avg(portfolio, n),
                counts
        );
    }

    private static double avg(double total, int n) {
        if (n <= 0) {
            return 0.0;
        }
        return Math.round(total / n * 100.0) / 100.0;
    }
}
