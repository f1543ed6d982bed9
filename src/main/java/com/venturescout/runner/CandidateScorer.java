package com.venturescout.runner;

import com.venturescout.model.CompanyProfile;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.model.ScoreBreakdown;

/**
 * Scores one candidate against one organization. Called concurrently from batch workers.
 */
@FunctionalInterface
public interface CandidateScorer {
    ScoreBreakdown score(CompanyProfile candidate, OrganizationProfile organization);
}
