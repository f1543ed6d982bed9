package com.venturescout.model;

import java.util.List;

public record BatchResult(List<ScoreBreakdown> ranked, BatchSummary summary) {
    public BatchResult {
        ranked = ranked == null ? List.of() : List.copyOf(ranked);
    }
}
