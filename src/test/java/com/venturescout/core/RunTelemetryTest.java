package com.venturescout.core;

import com.venturescout.vector.SimilarityCache;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("batch", "cli", Instant.parse("2026-02-23T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_LOAD_PROFILES);
        telemetry.endStep(RunTelemetry.STEP_LOAD_PROFILES, 2, 11, 0);
        telemetry.startStep(RunTelemetry.STEP_SCORE);
        telemetry.endStep(RunTelemetry.STEP_SCORE, 10, 10, 1, "one scorer failure");
        telemetry.recordBatch(10, 1, false);
        telemetry.recordCache(new SimilarityCache.CacheStats(6, 4, 3, 1, 0, 0, 3));
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_label=batch"));
        assertTrue(summary.contains("trigger=cli"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("candidates=10 failed=1 cancelled=false"));
        assertTrue(summary.contains("cache hits=6 misses=4"));
        assertTrue(summary.contains("hit_rate=0.60"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains(RunTelemetry.STEP_SCORE));
        assertTrue(summary.contains("note=one scorer failure"));
    }

    @Test
    void stepRecordsShouldAccumulateRepeatedSteps() {
        RunTelemetry telemetry = new RunTelemetry(null, null, null);
        telemetry.startStep("report");
        telemetry.endStep("report", 1, 1, 0);
        telemetry.startStep("REPORT");
        telemetry.endStep("REPORT", 1, 2, 0);

        assertEquals(1, telemetry.stepRecords().size());
        RunTelemetry.StepRecord record = telemetry.stepRecords().get(0);
        assertEquals("REPORT", record.name());
        assertEquals(2L, record.itemsIn());
        assertEquals(3L, record.itemsOut());
        assertEquals("batch", telemetry.runLabel());
    }
}
