package com.venturescout.scoring;

import com.venturescout.config.Config;
import com.venturescout.model.Assessment;
import com.venturescout.model.ConflictReport;
import com.venturescout.model.FitScore;
import com.venturescout.model.QualityScore;
import com.venturescout.model.Recommendation;
import com.venturescout.model.ScoreAssessor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps the overall score to a label and explains the component scores as pros and cons.
 */
public final class RecommendationPolicy implements ScoreAssessor {
    private final double strongThreshold;
    private final double goodThreshold;
    private final double moderateThreshold;

    public RecommendationPolicy() {
        this(80.0, 60.0, 40.0);
    }

    public RecommendationPolicy(double strongThreshold, double goodThreshold, double moderateThreshold) {
        if (!(strongThreshold >= goodThreshold && goodThreshold >= moderateThreshold)) {
            throw new IllegalArgumentException(String.format(Locale.US,
                    "recommendation thresholds must be ordered strong>=good>=moderate, got %.1f/%.1f/%.1f",
                    strongThreshold, goodThreshold, moderateThreshold));
        }
        this.strongThreshold = strongThreshold;
        this.goodThreshold = goodThreshold;
        this.moderateThreshold = moderateThreshold;
    }

    public static RecommendationPolicy fromConfig(Config config) {
        if (config == null) {
            return new RecommendationPolicy();
        }
        return new RecommendationPolicy(
                config.getDouble("recommendation.strong", 80.0),
                config.getDouble("recommendation.good", 60.0),
                config.getDouble("recommendation.moderate", 40.0)
        );
    }

    public Recommendation recommend(double overallScore) {
        if (overallScore >= strongThreshold) {
            return Recommendation.STRONG_MATCH;
        }
        if (overallScore >= goodThreshold) {
            return Recommendation.GOOD_MATCH;
        }
        if (overallScore >= moderateThreshold) {
            return Recommendation.MODERATE_MATCH;
        }
        return Recommendation.WEAK_MATCH;
    }

    @Override
    public Assessment assess(double overallScore, QualityScore quality, FitScore fit, ConflictReport conflict) {
        List<String> pros = new ArrayList<>();
        List<String> cons = new ArrayList<>();

        double fitScore = fit == null ? 0.0 : fit.fitScore;
        if (fitScore > 80.0) {
            pros.add(fmt("Excellent fit with investment thesis (%.1f)", fitScore));
        } else if (fitScore > 60.0) {
            pros.add(fmt("Good fit with investment thesis (%.1f)", fitScore));
        } else {
            cons.add(fmt("Limited alignment with investment thesis (%.1f)", fitScore));
        }

        double qualityScore = quality == null ? 0.0 : quality.overall;
        if (qualityScore > 80.0) {
            pros.add(fmt("High-quality founding team and company (%.1f)", qualityScore));
        } else if (qualityScore < 50.0) {
            cons.add(fmt("Founding team and company quality below bar (%.1f)", qualityScore));
        }

        if (conflict != null) {
            double portfolioFit = conflict.portfolioFitScore;
            if (portfolioFit > 70.0) {
                pros.add(fmt("Good portfolio fit, limited overlap with holdings (%.1f)", portfolioFit));
            } else if (portfolioFit < 40.0) {
                cons.add(fmt("Poor portfolio fit, strong overlap with holdings (%.1f)", portfolioFit));
            }
            if (conflict.hasConflicts()) {
                cons.add("Potential conflict with " + conflict.conflictingNames.size()
                        + " portfolio compan" + (conflict.conflictingNames.size() == 1 ? "y" : "ies")
                        + ": " + String.join(", ", conflict.conflictingNames));
            }
        }

        if (fit != null && fit.similarityDegraded) {
            cons.add("Thesis similarity could not be computed and counted as 0");
        }
        return new Assessment(recommend(overallScore), pros, cons);
    }

    private static String fmt(String pattern, double value) {
        return String.format(Locale.US, pattern, value);
    }
}
