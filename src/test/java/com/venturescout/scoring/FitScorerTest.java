package com.venturescout.scoring;

import com.venturescout.model.CompanyProfile;
import com.venturescout.model.FitScore;
import com.venturescout.model.FounderProfile;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.vector.EmbeddingClient;
import com.venturescout.vector.HashingEmbeddingClient;
import com.venturescout.vector.SimilarityCache;
import com.venturescout.vector.TextSimilarity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FitScorerTest {

    private final FitScorer scorer = new FitScorer(
            new TextSimilarity(new SimilarityCache(new HashingEmbeddingClient())),
            new QualityScorer()
    );

    @Test
    void industryMatch_shouldScoreExactPartialAndNone() {
        assertEquals(100.0, scorer.industryMatch("FinTech", List.of("fintech")), 1e-9);
        assertEquals(50.0, scorer.industryMatch("Payments", List.of("FinTech")), 1e-9);
        assertEquals(50.0, scorer.industryMatch("Enterprise SaaS", List.of("SaaS")), 1e-9);
        assertEquals(0.0, scorer.industryMatch("Biotech", List.of("SaaS")), 1e-9);
        assertEquals(0.0, scorer.industryMatch("", List.of("SaaS")), 1e-9);
        assertEquals(0.0, scorer.industryMatch("SaaS", List.of()), 1e-9);
    }

    @Test
    void stageMatch_shouldScoreExactAdjacentAndDistant() {
        assertEquals(100.0, scorer.stageMatch("series-a", List.of("Series A")), 1e-9);
        assertEquals(50.0, scorer.stageMatch("series-a", List.of("Seed")), 1e-9);
        assertEquals(0.0, scorer.stageMatch("series-a", List.of("Series C")), 1e-9);
        assertEquals(0.0, scorer.stageMatch("", List.of("Seed")), 1e-9);
    }

    @Test
    void resolveStage_shouldFallBackToDescription() {
        CompanyProfile explicit = CompanyProfile.builder().name("A").fundingStage("Series B").build();
        CompanyProfile inferred = CompanyProfile.builder()
                .name("B")
                .description("We are raising our pre-seed round to hire engineers")
                .build();
        CompanyProfile unknown = CompanyProfile.builder().name("C").description("Bootstrapped").build();

        assertEquals("series-b", scorer.resolveStage(explicit));
        assertEquals("pre-seed", scorer.resolveStage(inferred));
        assertEquals("", scorer.resolveStage(unknown));
    }

    @Test
    void locationMatch_shouldUseRegionsForPartialMatches() {
        assertEquals(100.0, scorer.locationMatch("San Francisco, CA", List.of("san francisco, ca")), 1e-9);
        assertEquals(50.0, scorer.locationMatch("San Francisco, CA", List.of("San Francisco")), 1e-9);
        assertEquals(50.0, scorer.locationMatch("Palo Alto, CA", List.of("San Francisco")), 1e-9);
        assertEquals(0.0, scorer.locationMatch("Austin, TX", List.of("Boston")), 1e-9);
        assertEquals(0.0, scorer.locationMatch("Lisbon", List.of("London")), 1e-9);
    }

    @Test
    void networkProximity_shouldRescaleFounderNetworkTo100() {
        FounderProfile strong = FounderProfile.builder().name("A").linkedinConnections(2000).endorsements(100).build();
        FounderProfile none = FounderProfile.builder().name("B").build();

        assertEquals(100.0, scorer.networkProximity(List.of(strong)), 1e-9);
        assertEquals(50.0, scorer.networkProximity(List.of(strong, none)), 1e-9);
        assertEquals(0.0, scorer.networkProximity(List.of()), 1e-9);
    }

    @Test
    void score_shouldFavorAlignedCandidate() {
        OrganizationProfile org = organization();
        CompanyProfile aligned = alignedCandidate();
        CompanyProfile unrelated = CompanyProfile.builder()
                .name("Petal")
                .description("Handmade flower arrangements for weddings")
                .industry("Retail Floristry")
                .location("Lisbon")
                .fundingStage("Series C")
                .build();

        FitScore a = scorer.score(aligned, org);
        FitScore b = scorer.score(unrelated, org);

        assertTrue(a.fitScore > b.fitScore);
        assertTrue(a.fitScore >= 0.0 && a.fitScore <= 100.0);
        assertEquals("seed", a.resolvedStage);
        assertFalse(a.similarityDegraded);
    }

    @Test
    void score_shouldTreatEncoderFailureAsZeroSimilarity() {
        EmbeddingClient broken = text -> {
            throw new IllegalStateException("model offline");
        };
        FitScorer degradedScorer = new FitScorer(
                new TextSimilarity(new SimilarityCache(broken)),
                new QualityScorer()
        );

        FitScore fit = degradedScorer.score(alignedCandidate(), organization());

        assertTrue(fit.similarityDegraded);
        assertEquals(0.0, fit.textSimilarity, 1e-9);
        assertEquals(100.0, fit.industryMatch, 1e-9);
        assertEquals(100.0, fit.stageMatch, 1e-9);
        assertEquals(100.0, fit.locationMatch, 1e-9);
        assertEquals(100.0, fit.networkProximity, 1e-9);
        assertEquals(60.0, fit.fitScore, 1e-9);
    }

    private static OrganizationProfile organization() {
        return OrganizationProfile.builder()
                .name("Northwind Ventures")
                .investmentThesis("Seed investments in fintech infrastructure and payments software")
                .preferredIndustries(List.of("FinTech"))
                .preferredStages(List.of("Seed"))
                .preferredLocations(List.of("New York, NY"))
                .build();
    }

    private static CompanyProfile alignedCandidate() {
        FounderProfile founder = FounderProfile.builder()
                .name("Sam Lee")
                .title("CEO")
                .experience("Payments infrastructure lead at Stripe")
                .linkedinConnections(1500)
                .endorsements(80)
                .build();
        return CompanyProfile.builder()
                .name("Ledgerly")
                .description("Payments infrastructure software for fintech companies")
                .industry("FinTech")
                .location("New York, NY")
                .fundingStage("Seed")
                .founders(List.of(founder))
                .build();
    }
}
