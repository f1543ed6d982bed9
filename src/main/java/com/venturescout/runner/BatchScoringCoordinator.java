package com.venturescout.runner;

import com.venturescout.core.RunTelemetry;
import com.venturescout.core.diagnostics.CauseCode;
import com.venturescout.model.BatchResult;
import com.venturescout.model.BatchSummary;
import com.venturescout.model.CompanyProfile;
import com.venturescout.model.MalformedProfileException;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.model.ScoreBreakdown;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Scores a batch of candidates against one organization on a bounded worker pool.
 * <p>
 * Results are collected on the calling thread and ranked by overall score (descending), then
 * candidate name, then input position, so the ranking does not depend on completion order. A
 * candidate whose scoring throws gets a zero result with a note; the rest of the batch continues.
 */
public final class BatchScoringCoordinator {
    private static final Logger log = LogManager.getLogger(BatchScoringCoordinator.class);

    public static final int DEFAULT_THREADS = 4;
    private static final long POLL_MILLIS = 50L;

    static final Comparator<ScoreBreakdown> RANKING = Comparator
            .comparingDouble((ScoreBreakdown b) -> b.overallScore).reversed()
            .thenComparing(b -> b.candidateName.toLowerCase(Locale.ROOT))
            .thenComparing(b -> b.candidateName);

    private final CandidateScorer scorer;
    private final int threads;
    private final RunTelemetry telemetry;

    public BatchScoringCoordinator(CandidateScorer scorer) {
        this(scorer, DEFAULT_THREADS, null);
    }

    public BatchScoringCoordinator(CandidateScorer scorer, int threads, RunTelemetry telemetry) {
        if (scorer == null) {
            throw new IllegalArgumentException("candidate scorer is required");
        }
        this.scorer = scorer;
        this.threads = Math.max(1, threads);
        this.telemetry = telemetry;
    }

    public BatchResult scoreAll(List<CompanyProfile> candidates, OrganizationProfile organization) {
        return scoreAll(candidates, organization, CancellationSignal.none());
    }

    /**
     * @throws MalformedProfileException before any work starts when the organization or any
     *                                   candidate has no name
     */
    public BatchResult scoreAll(
            List<CompanyProfile> candidates,
            OrganizationProfile organization,
            CancellationSignal cancellation
    ) {
        startStep(RunTelemetry.STEP_VALIDATE);
        try {
            validate(candidates, organization);
        } finally {
            endStep(RunTelemetry.STEP_VALIDATE, candidates == null ? 0 : candidates.size(), 0, 0);
        }
        CancellationSignal cancel = cancellation == null ? CancellationSignal.none() : cancellation;
        List<CompanyProfile> input = List.copyOf(candidates);
        int total = input.size();
        log.info("batch start organization={} candidates={} threads={}", organization.name, total, Math.min(threads, Math.max(1, total)));

        if (total == 0) {
            return finish(organization, 0, new ArrayList<>(), false);
        }

        startStep(RunTelemetry.STEP_SCORE);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, total));
        CompletionService<Ranked> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Ranked>, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < total; i++) {
            Future<Ranked> future = completion.submit(new CandidateTask(i, input.get(i), organization, cancel));
            positions.put(future, i);
        }

        List<Ranked> done = new ArrayList<>(total);
        int received = 0;
        int failed = 0;
        boolean cancelled = false;
        try {
            while (received < total) {
                if (cancel.isCancelled()) {
                    cancelled = true;
                    // keep rows that finished before the cancel was seen
                    Future<Ranked> ready;
                    while ((ready = completion.poll()) != null) {
                        received++;
                        Ranked row = collect(ready, positions, input);
                        if (!row.skipped()) {
                            failed += row.breakdown.isFailed() ? 1 : 0;
                            done.add(row);
                        }
                    }
                    break;
                }
                Future<Ranked> future = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (future == null) {
                    continue;
                }
                received++;
                Ranked row = collect(future, positions, input);
                if (row.skipped()) {
                    continue;
                }
                if (row.breakdown.isFailed()) {
                    failed++;
                }
                done.add(row);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
        } finally {
            if (cancelled) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
            endStep(RunTelemetry.STEP_SCORE, total, done.size(), failed);
        }

        if (cancelled) {
            log.warn("batch cancelled organization={} completed={} of {}", organization.name, done.size(), total);
        }
        done.sort(Comparator.comparing((Ranked r) -> r.breakdown, RANKING).thenComparingInt(r -> r.position));
        List<ScoreBreakdown> ranked = new ArrayList<>(done.size());
        for (Ranked r : done) {
            ranked.add(r.breakdown);
        }
        return finish(organization, total, ranked, cancelled);
    }

    /**
     * Result of a completed future. A task that crashed outside the scorer becomes a failed row.
     */
    private static Ranked collect(Future<Ranked> future, Map<Future<Ranked>, Integer> positions, List<CompanyProfile> input)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            int index = positions.getOrDefault(future, -1);
            String name = index >= 0 ? input.get(index).name : "";
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("candidate task crashed name={} err={}", name, cause.toString());
            return new Ranked(index, ScoreBreakdown.failed(name, CauseCode.SCORER_FAILURE, "scoring failed: " + cause));
        }
    }

    public int threads() {
        return threads;
    }

    private BatchResult finish(OrganizationProfile organization, int total, List<ScoreBreakdown> ranked, boolean cancelled) {
        BatchSummary summary = BatchSummary.of(organization.name, total, ranked, cancelled);
        if (telemetry != null) {
            telemetry.recordBatch(total, summary.failed, cancelled);
        }
        log.info("batch done organization={} scored={} failed={} cancelled={} avg_overall={}",
                organization.name, summary.scored, summary.failed, cancelled, summary.averageOverall);
        return new BatchResult(ranked, summary);
    }

    static void validate(List<CompanyProfile> candidates, OrganizationProfile organization) {
        if (organization == null || organization.name.isEmpty()) {
            throw new MalformedProfileException("organization profile must have a name");
        }
        if (candidates == null) {
            throw new MalformedProfileException("candidate list is required");
        }
        List<Integer> bad = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            CompanyProfile candidate = candidates.get(i);
            if (candidate == null || candidate.name.isEmpty()) {
                bad.add(i);
            }
        }
        if (!bad.isEmpty()) {
            throw new MalformedProfileException("candidates without a name at positions " + bad);
        }
    }

    private void startStep(String step) {
        if (telemetry != null) {
            telemetry.startStep(step);
        }
    }

    private void endStep(String step, long in, long out, long errors) {
        if (telemetry != null) {
            telemetry.endStep(step, in, out, errors);
        }
    }

    private final class CandidateTask implements Callable<Ranked> {
        private final int position;
        private final CompanyProfile candidate;
        private final OrganizationProfile organization;
        private final CancellationSignal cancel;

        private CandidateTask(int position, CompanyProfile candidate, OrganizationProfile organization, CancellationSignal cancel) {
            this.position = position;
            this.candidate = candidate;
            this.organization = organization;
            this.cancel = cancel;
        }

        @Override
        public Ranked call() {
            if (cancel.isCancelled()) {
                return Ranked.skipped(position);
            }
            try {
                ScoreBreakdown breakdown = scorer.score(candidate, organization);
                if (breakdown == null) {
                    throw new IllegalStateException("scorer returned no result");
                }
                return new Ranked(position, breakdown);
            } catch (RuntimeException e) {
                log.warn("candidate scoring failed name={} err={}", candidate.name, e.toString());
                return new Ranked(position, ScoreBreakdown.failed(
                        candidate.name,
                        CauseCode.SCORER_FAILURE,
                        "scoring failed: " + e.getClass().getSimpleName() + ": " + e.getMessage()
                ));
            }
        }
    }

    private static final class Ranked {
        private final int position;
        private final ScoreBreakdown breakdown;

        private Ranked(int position, ScoreBreakdown breakdown) {
            this.position = position;
            this.breakdown = breakdown;
        }

        private static Ranked skipped(int position) {
            return new Ranked(position, null);
        }

        private boolean skipped() {
            return breakdown == null;
        }
    }
}
