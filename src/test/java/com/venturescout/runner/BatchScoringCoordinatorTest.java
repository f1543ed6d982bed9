package com.venturescout.runner;

import com.venturescout.core.RunTelemetry;
import com.venturescout.core.diagnostics.CauseCode;
import com.venturescout.model.BatchResult;
import com.venturescout.model.CompanyProfile;
import com.venturescout.model.ConflictReport;
import com.venturescout.model.FitScore;
import com.venturescout.model.FounderProfile;
import com.venturescout.model.MalformedProfileException;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.model.OverallWeights;
import com.venturescout.model.PortfolioHolding;
import com.venturescout.model.QualityScore;
import com.venturescout.model.ScoreBreakdown;
import com.venturescout.output.ReportWriter;
import com.venturescout.portfolio.PortfolioConflictAnalyzer;
import com.venturescout.scoring.FitScorer;
import com.venturescout.scoring.QualityScorer;
import com.venturescout.scoring.RecommendationPolicy;
import com.venturescout.vector.HashingEmbeddingClient;
import com.venturescout.vector.SimilarityCache;
import com.venturescout.vector.TextSimilarity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchScoringCoordinatorTest {

    private static final OrganizationProfile ORG = OrganizationProfile.builder().name("Northwind Ventures").build();
    private static final RecommendationPolicy POLICY = new RecommendationPolicy();

    @Test
    void scoreAll_shouldReturnOneRankedRowPerCandidate() {
        Map<String, Double> fits = Map.of("Alpha", 20.0, "Bravo", 90.0, "Charlie", 55.0, "Delta", 70.0);
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(fixedScorer(fits), 3, null);

        BatchResult result = coordinator.scoreAll(candidates("Alpha", "Bravo", "Charlie", "Delta"), ORG);

        assertEquals(4, result.ranked().size());
        assertEquals(List.of("Bravo", "Delta", "Charlie", "Alpha"), names(result));
        for (int i = 1; i < result.ranked().size(); i++) {
            assertTrue(result.ranked().get(i - 1).overallScore >= result.ranked().get(i).overallScore);
        }
        assertEquals(4, result.summary().candidates);
        assertEquals(4, result.summary().scored);
        assertEquals(0, result.summary().failed);
    }

    @Test
    void scoreAll_shouldBreakTiesByName() {
        Map<String, Double> fits = Map.of("zeta", 50.0, "Alpha", 50.0, "beta", 50.0);
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(fixedScorer(fits), 2, null);

        BatchResult result = coordinator.scoreAll(candidates("zeta", "Alpha", "beta"), ORG);

        assertEquals(List.of("Alpha", "beta", "zeta"), names(result));
    }

    @Test
    void scoreAll_shouldRankIdenticallyRegardlessOfCompletionOrder() {
        List<CompanyProfile> input = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            input.add(CompanyProfile.builder().name("Startup " + i).build());
        }
        CandidateScorer jittery = (candidate, org) -> {
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(3));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            int n = Integer.parseInt(candidate.name.substring("Startup ".length()));
            return breakdown(candidate.name, (n * 37) % 100);
        };

        List<String> first = names(new BatchScoringCoordinator(jittery, 8, null).scoreAll(input, ORG));
        List<String> second = names(new BatchScoringCoordinator(jittery, 8, null).scoreAll(input, ORG));
        List<String> single = names(new BatchScoringCoordinator(jittery, 1, null).scoreAll(input, ORG));

        assertEquals(first, second);
        assertEquals(first, single);
    }

    @Test
    void scoreAll_shouldIsolateFailingCandidate() {
        Map<String, Double> fits = Map.of("Alpha", 80.0, "Charlie", 40.0);
        CandidateScorer scorer = (candidate, org) -> {
            if ("Bravo".equals(candidate.name)) {
                throw new IllegalStateException("boom");
            }
            return breakdown(candidate.name, fits.get(candidate.name));
        };
        RunTelemetry telemetry = new RunTelemetry("test", "unit", Instant.parse("2026-01-01T00:00:00Z"));
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(scorer, 2, telemetry);

        BatchResult result = coordinator.scoreAll(candidates("Alpha", "Bravo", "Charlie"), ORG);

        assertEquals(3, result.ranked().size());
        ScoreBreakdown failed = result.ranked().get(2);
        assertEquals("Bravo", failed.candidateName);
        assertEquals(0.0, failed.overallScore, 1e-9);
        assertEquals(CauseCode.SCORER_FAILURE, failed.causeCode);
        assertTrue(failed.notes.get(0).contains("IllegalStateException: boom"));
        assertEquals(1, result.summary().failed);
        assertEquals(2, result.summary().scored);
        assertTrue(telemetry.getSummary().contains("candidates=3 failed=1 cancelled=false"));
    }

    @Test
    void scoreAll_shouldStopWhenCancelled() {
        CancellationSignal cancel = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        CandidateScorer cancelling = (candidate, org) -> {
            calls.incrementAndGet();
            cancel.cancel();
            return breakdown(candidate.name, 50.0);
        };
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(cancelling, 1, null);

        BatchResult result = coordinator.scoreAll(candidates("A", "B", "C", "D", "E"), ORG, cancel);

        assertTrue(result.summary().cancelled);
        assertTrue(result.ranked().size() < 5);
        assertEquals(1, calls.get());
    }

    @Test
    void scoreAll_shouldKeepRowsFinishedBeforeCancellation() {
        for (int run = 0; run < 20; run++) {
            CancellationSignal cancel = new CancellationSignal();
            CandidateScorer lastOneCancels = (candidate, org) -> {
                if ("D".equals(candidate.name)) {
                    cancel.cancel();
                }
                return breakdown(candidate.name, 40.0);
            };
            // one worker: A, B and C are queued before D runs and cancels
            BatchScoringCoordinator coordinator = new BatchScoringCoordinator(lastOneCancels, 1, null);

            BatchResult result = coordinator.scoreAll(candidates("A", "B", "C", "D"), ORG, cancel);

            List<String> names = names(result);
            assertTrue(names.containsAll(List.of("A", "B", "C")), "run " + run + " returned " + names);
            assertEquals(names.size(), result.summary().scored);
        }
    }

    @Test
    void scoreAll_shouldProduceIdenticalReportsForIdenticalInputs() {
        OrganizationProfile org = OrganizationProfile.builder()
                .name("Northwind Ventures")
                .investmentThesis("Seed investments in fintech infrastructure and payments software")
                .preferredIndustries(List.of("FinTech", "SaaS"))
                .preferredStages(List.of("Seed"))
                .preferredLocations(List.of("New York"))
                .portfolio(List.of(new PortfolioHolding("PayRail", "FinTech", "Payments infrastructure for banks")))
                .build();
        List<CompanyProfile> input = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            input.add(CompanyProfile.builder()
                    .name("Startup " + i)
                    .description("Seed stage " + (i % 2 == 0 ? "payments software" : "logistics marketplace") + " team " + i)
                    .industry(i % 3 == 0 ? "FinTech" : "Logistics")
                    .location(i % 2 == 0 ? "New York, NY" : "Austin, TX")
                    .founders(List.of(FounderProfile.builder()
                            .name("Founder " + i)
                            .title(i % 2 == 0 ? "CEO" : "CTO")
                            .experience((i + 1) + " years at Stripe")
                            .linkedinConnections(100 * i)
                            .build()))
                    .build());
        }
        ReportWriter writer = new ReportWriter();

        String first = writer.toJson(new BatchScoringCoordinator(realPipeline(), 4, null).scoreAll(input, org)).toString(2);
        String second = writer.toJson(new BatchScoringCoordinator(realPipeline(), 4, null).scoreAll(input, org)).toString(2);
        String serial = writer.toJson(new BatchScoringCoordinator(realPipeline(), 1, null).scoreAll(input, org)).toString(2);

        assertEquals(first, second);
        assertEquals(first, serial);
    }

    @Test
    void scoreAll_shouldRejectUnnamedCandidatesBeforeScoring() {
        AtomicInteger calls = new AtomicInteger();
        CandidateScorer counting = (candidate, org) -> {
            calls.incrementAndGet();
            return breakdown(candidate.name, 10.0);
        };
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(counting);
        List<CompanyProfile> input = List.of(
                CompanyProfile.builder().name("Alpha").build(),
                CompanyProfile.builder().name("  ").build()
        );

        MalformedProfileException error = assertThrows(MalformedProfileException.class,
                () -> coordinator.scoreAll(input, ORG));

        assertTrue(error.getMessage().contains("[1]"));
        assertEquals(0, calls.get());
    }

    @Test
    void scoreAll_shouldRejectUnnamedOrganization() {
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(fixedScorer(Map.of()));
        OrganizationProfile anonymous = OrganizationProfile.builder().build();

        assertThrows(MalformedProfileException.class, () -> coordinator.scoreAll(candidates("Alpha"), anonymous));
    }

    @Test
    void scoreAll_shouldHandleEmptyBatch() {
        BatchScoringCoordinator coordinator = new BatchScoringCoordinator(fixedScorer(Map.of()));

        BatchResult result = coordinator.scoreAll(List.of(), ORG);

        assertTrue(result.ranked().isEmpty());
        assertEquals(0, result.summary().candidates);
        assertEquals(0.0, result.summary().averageOverall, 1e-9);
    }

    private static ScoringPipeline realPipeline() {
        QualityScorer quality = new QualityScorer();
        TextSimilarity similarity = new TextSimilarity(new SimilarityCache(new HashingEmbeddingClient()));
        return new ScoringPipeline(
                quality,
                new FitScorer(similarity, quality),
                new PortfolioConflictAnalyzer(similarity),
                POLICY,
                OverallWeights.DEFAULT
        );
    }

    private static CandidateScorer fixedScorer(Map<String, Double> fits) {
        return (candidate, org) -> breakdown(candidate.name, fits.getOrDefault(candidate.name, 0.0));
    }

    private static ScoreBreakdown breakdown(String name, double fit) {
        FitScore fitScore = FitScore.zero().toBuilder().fitScore(fit).build();
        return ScoreBreakdown.scored(
                name,
                QualityScore.zero(),
                fitScore,
                ConflictReport.none(),
                OverallWeights.DEFAULT,
                POLICY,
                List.of()
        );
    }

    private static List<CompanyProfile> candidates(String... names) {
        List<CompanyProfile> out = new ArrayList<>();
        for (String name : names) {
            out.add(CompanyProfile.builder().name(name).build());
        }
        return out;
    }

    private static List<String> names(BatchResult result) {
        List<String> out = new ArrayList<>();
        for (ScoreBreakdown row : result.ranked()) {
            out.add(row.candidateName);
        }
        return out;
    }
}
