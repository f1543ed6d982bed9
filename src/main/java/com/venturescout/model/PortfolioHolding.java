package com.venturescout.model;

/**
 * A company the organization already holds. Only the name is required.
 */
public record PortfolioHolding(
        String name,
        String industry,
        String description
) {
    public PortfolioHolding {
        name = name == null ? "" : name.trim();
        industry = industry == null ? "" : industry.trim();
        description = description == null ? "" : description.trim();
    }

    public static PortfolioHolding named(String name) {
        return new PortfolioHolding(name, "", "");
    }

    /**
     * Text compared against candidates; falls back to the name when nothing else is known.
     */
    public String comparisonText() {
        String text = (description + " " + industry).trim();
        return text.isEmpty() ? name : text;
    }
}
