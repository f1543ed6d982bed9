package com.venturescout.model;

@FunctionalInterface
public interface ScoreAssessor {
    Assessment assess(double overallScore, QualityScore quality, FitScore fit, ConflictReport conflict);
}
