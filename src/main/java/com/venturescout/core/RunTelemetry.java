package com.venturescout.core;

import com.venturescout.vector.SimilarityCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Timings and counters for one scoring run. Kept out of the ranked output so that output stays
 * reproducible; printed at the end of a run instead.
 * <p>
 * Step names are case-insensitive. A step may run more than once; its counters accumulate.
 */
public final class RunTelemetry {
    private static final Logger log = LogManager.getLogger(RunTelemetry.class);

    public static final String STEP_LOAD_PROFILES = "LOAD_PROFILES";
    public static final String STEP_VALIDATE = "VALIDATE";
    public static final String STEP_SCORE = "SCORE";
    public static final String STEP_REPORT = "REPORT";

    private final String runLabel;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private int candidates;
    private int failed;
    private boolean cancelled;
    private long errors;
    private SimilarityCache.CacheStats cacheStats;

    private final Map<String, Step> steps = new LinkedHashMap<>();

    public RunTelemetry(String runLabel, String trigger, Instant startedAt) {
        this.runLabel = orDefault(runLabel, "batch");
        this.trigger = orDefault(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runLabel() {
        return runLabel;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        step(name).openedAtNanos.add(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, null);
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        Step step = step(name);
        if (!step.openedAtNanos.isEmpty()) {
            long opened = step.openedAtNanos.remove(step.openedAtNanos.size() - 1);
            step.elapsedMs += Math.max(0L, (System.nanoTime() - opened) / 1_000_000L);
        }
        step.in += Math.max(0L, itemsIn);
        step.out += Math.max(0L, itemsOut);
        long err = Math.max(0L, errorCount);
        step.errors += err;
        errors += err;
        if (note != null && !note.isBlank()) {
            step.notes.add(note.trim());
        }
    }

    public synchronized void recordBatch(int total, int failedCount, boolean wasCancelled) {
        candidates = Math.max(0, total);
        failed = Math.max(0, failedCount);
        cancelled = wasCancelled;
    }

    public synchronized void recordCache(SimilarityCache.CacheStats stats) {
        cacheStats = stats;
    }

    /**
     * Freezes the end time. Later calls keep the first value.
     */
    public synchronized void finish() {
        if (finishedAt != null) {
            return;
        }
        finishedAt = Instant.now();
        log.info("run finished label={} trigger={} elapsed_ms={} candidates={} failed={} cancelled={}",
                runLabel, trigger, totalElapsedMs(), candidates, failed, cancelled);
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>(steps.size());
        steps.forEach((name, s) -> out.add(new StepRecord(name, s.elapsedMs, s.in, s.out, s.errors, String.join("; ", s.notes))));
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        List<String> lines = new ArrayList<>();
        lines.add("run_label=" + runLabel);
        lines.add("trigger=" + trigger);
        lines.add("started_at=" + startedAt);
        lines.add("finished_at=" + end);
        lines.add("total_elapsed_ms=" + totalElapsedMs());
        lines.add("candidates=" + candidates + " failed=" + failed + " cancelled=" + cancelled);
        if (cacheStats != null) {
            lines.add(String.format(Locale.US,
                    "cache hits=%d misses=%d computations=%d coalesced=%d evictions=%d failures=%d size=%d hit_rate=%.2f",
                    cacheStats.hits(), cacheStats.misses(), cacheStats.computations(), cacheStats.coalesced(),
                    cacheStats.evictions(), cacheStats.failures(), cacheStats.size(), cacheStats.hitRate()));
        }
        lines.add("errors_total=" + errors);
        lines.add("steps:");
        for (StepRecord r : stepRecords()) {
            String line = String.format(Locale.US, "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    r.name(), r.elapsedMs(), r.itemsIn(), r.itemsOut(), r.errorCount());
            lines.add(r.optionalNote().isEmpty() ? line : line + " note=" + r.optionalNote());
        }
        return String.join("\n", lines);
    }

    private Step step(String name) {
        String key = name == null || name.isBlank() ? "UNKNOWN_STEP" : name.trim().toUpperCase(Locale.ROOT);
        return steps.computeIfAbsent(key, k -> new Step());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static final class Step {
        private final List<Long> openedAtNanos = new ArrayList<>();
        private final Set<String> notes = new LinkedHashSet<>();
        private long elapsedMs;
        private long in;
        private long out;
        private long errors;
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
