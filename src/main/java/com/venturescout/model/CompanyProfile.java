package com.venturescout.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A candidate company. {@code foundedYear} of 0 means unknown; {@code fundingStage} and
 * {@code website} may be empty.
 */
public final class CompanyProfile {
    public final String name;
    public final String description;
    public final String industry;
    public final String location;
    public final int foundedYear;
    public final String fundingStage;
    public final String website;
    public final List<FounderProfile> founders;

    @Builder(toBuilder = true)
    public CompanyProfile(
            String name,
            String description,
            String industry,
            String location,
            int foundedYear,
            String fundingStage,
            String website,
            List<FounderProfile> founders
    ) {
        this.name = safe(name);
        this.description = safe(description);
        this.industry = safe(industry);
        this.location = safe(location);
        this.foundedYear = Math.max(0, foundedYear);
        this.fundingStage = safe(fundingStage);
        this.website = safe(website);
        List<FounderProfile> copy = new ArrayList<>();
        if (founders != null) {
            for (FounderProfile founder : founders) {
                if (founder != null) {
                    copy.add(founder);
                }
            }
        }
        this.founders = Collections.unmodifiableList(copy);
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }

    @Override
    public String toString() {
        return "CompanyProfile{name=" + name + ", industry=" + industry + ", founders=" + founders.size() + "}";
    }
}
