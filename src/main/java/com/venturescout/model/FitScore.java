package com.venturescout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FitScore {
    public final double fitScore;
    public final double textSimilarity;
    public final double industryMatch;
    public final double stageMatch;
    public final double locationMatch;
    public final double networkProximity;
    public final String resolvedStage;
    public final boolean similarityDegraded;

    public static FitScore zero() {
        return new FitScore(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, "", false);
    }
}
