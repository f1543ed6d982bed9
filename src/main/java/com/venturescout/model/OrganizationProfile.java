package com.venturescout.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模块说明：OrganizationProfile（class）。
 * 主要职责：描述投资机构的投资主张、偏好与现有持仓，是所有候选评分的共同参照。
 */
public final class OrganizationProfile {
    public final String name;
    public final String investmentThesis;
    public final List<String> preferredIndustries;
    public final List<String> preferredStages;
    public final List<String> preferredLocations;
    public final List<PortfolioHolding> portfolio;

    @Builder(toBuilder = true)
    public OrganizationProfile(
            String name,
            String investmentThesis,
            List<String> preferredIndustries,
            List<String> preferredStages,
            List<String> preferredLocations,
            List<PortfolioHolding> portfolio
    ) {
        this.name = name == null ? "" : name.trim();
        this.investmentThesis = investmentThesis == null ? "" : investmentThesis.trim();
        this.preferredIndustries = cleanList(preferredIndustries);
        this.preferredStages = cleanList(preferredStages);
        this.preferredLocations = cleanList(preferredLocations);
        List<PortfolioHolding> holdings = new ArrayList<>();
        if (portfolio != null) {
            for (PortfolioHolding holding : portfolio) {
                if (holding != null && !holding.name().isEmpty()) {
                    holdings.add(holding);
                }
            }
        }
        this.portfolio = Collections.unmodifiableList(holdings);
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return Collections.unmodifiableList(out);
    }
}
