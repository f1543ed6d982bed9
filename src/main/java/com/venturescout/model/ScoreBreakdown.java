package com.venturescout.model;

import com.venturescout.core.diagnostics.CauseCode;

import java.util.List;

/**
 * Result for one candidate within one scoring pass. Instances only come from {@link #scored} and
 * {@link #failed}; the overall score is always derived from the three component scores.
 */
public final class ScoreBreakdown {
    public final String candidateName;
    public final String website;
    public final double qualityScore;
    public final double fitScore;
    public final double portfolioFitScore;
    public final double overallScore;
    public final Recommendation recommendation;
    public final List<String> pros;
    public final List<String> cons;
    public final List<String> notes;
    public final CauseCode causeCode;
    public final QualityScore quality;
    public final FitScore fit;
    public final ConflictReport conflict;

    private ScoreBreakdown(
            String candidateName,
            String website,
            QualityScore quality,
            FitScore fit,
            ConflictReport conflict,
            double overallScore,
            Assessment assessment,
            List<String> notes,
            CauseCode causeCode
    ) {
        this.candidateName = candidateName == null ? "" : candidateName;
        this.website = website == null ? "" : website.trim();
        this.quality = quality == null ? QualityScore.zero() : quality;
        this.fit = fit == null ? FitScore.zero() : fit;
        this.conflict = conflict;
        this.qualityScore = this.quality.overall;
        this.fitScore = this.fit.fitScore;
        this.portfolioFitScore = conflict == null ? 0.0 : conflict.portfolioFitScore;
        this.overallScore = overallScore;
        this.recommendation = assessment.recommendation();
        this.pros = assessment.pros();
        this.cons = assessment.cons();
        this.notes = notes == null ? List.of() : List.copyOf(notes);
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
    }

    public static ScoreBreakdown scored(
            String candidateName,
            QualityScore quality,
            FitScore fit,
            ConflictReport conflict,
            OverallWeights weights,
            ScoreAssessor assessor,
            List<String> notes
    ) {
        return scored(candidateName, "", quality, fit, conflict, weights, assessor, notes);
    }

    public static ScoreBreakdown scored(
            String candidateName,
            String website,
            QualityScore quality,
            FitScore fit,
            ConflictReport conflict,
            OverallWeights weights,
            ScoreAssessor assessor,
            List<String> notes
    ) {
        QualityScore q = quality == null ? QualityScore.zero() : quality;
        FitScore f = fit == null ? FitScore.zero() : fit;
        ConflictReport c = conflict == null ? ConflictReport.none() : conflict;
        OverallWeights w = weights == null ? OverallWeights.DEFAULT : weights;
        double overall = w.blend(f.fitScore, q.overall, c.portfolioFitScore);
        Assessment assessment = assessor == null
                ? new Assessment(Recommendation.WEAK_MATCH, List.of(), List.of())
                : assessor.assess(overall, q, f, c);
        CauseCode cause = f.similarityDegraded ? CauseCode.SIMILARITY_UNAVAILABLE : CauseCode.NONE;
        return new ScoreBreakdown(candidateName, website, q, f, c, overall, assessment, notes, cause);
    }

    /**
     * Zero-score result for a candidate whose scoring failed.
     */
    public static ScoreBreakdown failed(String candidateName, CauseCode causeCode, String note) {
        List<String> notes = note == null || note.isBlank() ? List.of() : List.of(note.trim());
        return new ScoreBreakdown(
                candidateName,
                "",
                QualityScore.zero(),
                FitScore.zero(),
                null,
                0.0,
                new Assessment(Recommendation.WEAK_MATCH, List.of(), List.of()),
                notes,
                causeCode == null ? CauseCode.SCORER_FAILURE : causeCode
        );
    }

    public boolean isFailed() {
        return causeCode == CauseCode.SCORER_FAILURE;
    }
}
