package com.venturescout.runner;

import com.venturescout.model.CompanyProfile;
import com.venturescout.model.ConflictReport;
import com.venturescout.model.FitScore;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.model.OverallWeights;
import com.venturescout.model.QualityScore;
import com.venturescout.model.ScoreAssessor;
import com.venturescout.model.ScoreBreakdown;
import com.venturescout.portfolio.PortfolioConflictAnalyzer;
import com.venturescout.scoring.FitScorer;
import com.venturescout.scoring.QualityScorer;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality, fit and portfolio conflict for one candidate, run one after another on the calling
 * thread and merged into a {@link ScoreBreakdown}.
 */
public final class ScoringPipeline implements CandidateScorer {
    private final QualityScorer qualityScorer;
    private final FitScorer fitScorer;
    private final PortfolioConflictAnalyzer conflictAnalyzer;
    private final ScoreAssessor assessor;
    private final OverallWeights weights;

    public ScoringPipeline(
            QualityScorer qualityScorer,
            FitScorer fitScorer,
            PortfolioConflictAnalyzer conflictAnalyzer,
            ScoreAssessor assessor,
            OverallWeights weights
    ) {
        if (qualityScorer == null || fitScorer == null || conflictAnalyzer == null || assessor == null) {
            throw new IllegalArgumentException("quality, fit, conflict and assessor components are required");
        }
        this.qualityScorer = qualityScorer;
        this.fitScorer = fitScorer;
        this.conflictAnalyzer = conflictAnalyzer;
        this.assessor = assessor;
        this.weights = weights == null ? OverallWeights.DEFAULT : weights;
    }

    @Override
    public ScoreBreakdown score(CompanyProfile candidate, OrganizationProfile organization) {
        QualityScore quality = qualityScorer.score(candidate);
        FitScore fit = fitScorer.score(candidate, organization);
        ConflictReport conflict = conflictAnalyzer.analyze(candidate, organization.portfolio);

        List<String> notes = new ArrayList<>();
        if (candidate.founders.isEmpty()) {
            notes.add("no founders listed; quality scored as 0");
        }
        if (fit.similarityDegraded) {
            notes.add("text similarity unavailable; scored as 0");
        }
        return ScoreBreakdown.scored(candidate.name, candidate.website, quality, fit, conflict, weights, assessor, notes);
    }
}
