package com.venturescout.model;

import lombok.Builder;

/**
 * 模块说明：FounderProfile（class）。
 * 主要职责：承载单个创始人的公开资料文本与社交指标，构造时完成空值归一。
 */
public final class FounderProfile {
    public final String name;
    public final String title;
    public final String experience;
    public final String education;
    public final String honors;
    public final int linkedinConnections;
    public final int endorsements;

    @Builder(toBuilder = true)
    public FounderProfile(
            String name,
            String title,
            String experience,
            String education,
            String honors,
            int linkedinConnections,
            int endorsements
    ) {
        this.name = safe(name);
        this.title = safe(title);
        this.experience = safe(experience);
        this.education = safe(education);
        this.honors = safe(honors);
        this.linkedinConnections = Math.max(0, linkedinConnections);
        this.endorsements = Math.max(0, endorsements);
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }

    @Override
    public String toString() {
        return "FounderProfile{name=" + name + ", title=" + title + "}";
    }
}
