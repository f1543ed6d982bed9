package com.venturescout.model;

public enum Recommendation {
    STRONG_MATCH("Strong Match"),
    GOOD_MATCH("Good Match"),
    MODERATE_MATCH("Moderate Match"),
    WEAK_MATCH("Weak Match");

    private final String label;

    Recommendation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
