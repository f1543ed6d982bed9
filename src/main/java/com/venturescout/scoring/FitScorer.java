package com.venturescout.scoring;

import com.venturescout.config.Config;
import com.venturescout.config.FitRules;
import com.venturescout.model.CompanyProfile;
import com.venturescout.model.FitScore;
import com.venturescout.model.FounderProfile;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.vector.EmbeddingException;
import com.venturescout.vector.TextSimilarity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Alignment of a candidate with an organization's stated criteria.
 */
public final class FitScorer {
    private static final Logger log = LogManager.getLogger(FitScorer.class);

    static final double EXACT = 100.0;
    static final double PARTIAL = 50.0;

    private static final int FOUNDERS_IN_TEXT = 2;
    private static final int EXPERIENCE_CHARS = 200;
    private static final int FOCUS_AREAS_IN_TEXT = 5;

    private final TextSimilarity similarity;
    private final QualityScorer qualityScorer;
    private final FitRules rules;
    private final FitWeights weights;

    public FitScorer(TextSimilarity similarity, QualityScorer qualityScorer) {
        this(similarity, qualityScorer, FitRules.defaults(), FitWeights.DEFAULT);
    }

    public FitScorer(TextSimilarity similarity, QualityScorer qualityScorer, Config config) {
        this(similarity, qualityScorer, FitRules.defaults(), FitWeights.fromConfig(config));
    }

    public FitScorer(TextSimilarity similarity, QualityScorer qualityScorer, FitRules rules, FitWeights weights) {
        if (similarity == null) {
            throw new IllegalArgumentException("text similarity is required");
        }
        this.similarity = similarity;
        this.qualityScorer = qualityScorer == null ? new QualityScorer() : qualityScorer;
        this.rules = rules == null ? FitRules.defaults() : rules;
        this.weights = weights == null ? FitWeights.DEFAULT : weights;
    }

    public FitScore score(CompanyProfile candidate, OrganizationProfile organization) {
        if (candidate == null || organization == null) {
            return FitScore.zero();
        }
        boolean degraded = false;
        double textSimilarity;
        try {
            textSimilarity = similarity.score(candidateText(candidate), organizationText(organization));
        } catch (EmbeddingException e) {
            log.warn("text similarity unavailable candidate={} err={}", candidate.name, e.getMessage());
            textSimilarity = 0.0;
            degraded = true;
        }
        double industry = industryMatch(candidate.industry, organization.preferredIndustries);
        String stage = resolveStage(candidate);
        double stageMatch = stageMatch(stage, organization.preferredStages);
        double location = locationMatch(candidate.location, organization.preferredLocations);
        double network = networkProximity(candidate.founders);

        double sum = weights.sum();
        double raw = sum <= 0.0
                ? 0.0
                : (textSimilarity * weights.similarity()
                + industry * weights.industry()
                + stageMatch * weights.stage()
                + location * weights.location()
                + network * weights.network()) / sum;

        return FitScore.builder()
                .fitScore(QualityScorer.round2(QualityScorer.clamp(raw, 0.0, 100.0)))
                .textSimilarity(QualityScorer.round2(textSimilarity))
                .industryMatch(industry)
                .stageMatch(stageMatch)
                .locationMatch(location)
                .networkProximity(QualityScorer.round2(network))
                .resolvedStage(stage)
                .similarityDegraded(degraded)
                .build();
    }

    /**
     * Description, industry, then title and the start of the experience of the first founders.
     */
    public String candidateText(CompanyProfile candidate) {
        List<String> parts = new ArrayList<>();
        parts.add(candidate.description);
        parts.add(candidate.industry);
        int n = Math.min(FOUNDERS_IN_TEXT, candidate.founders.size());
        for (int i = 0; i < n; i++) {
            FounderProfile founder = candidate.founders.get(i);
            parts.add(founder.title);
            String exp = founder.experience;
            parts.add(exp.length() > EXPERIENCE_CHARS ? exp.substring(0, EXPERIENCE_CHARS) : exp);
        }
        return join(parts);
    }

    public String organizationText(OrganizationProfile organization) {
        List<String> parts = new ArrayList<>();
        parts.add(organization.investmentThesis);
        List<String> focus = organization.preferredIndustries;
        parts.addAll(focus.subList(0, Math.min(FOCUS_AREAS_IN_TEXT, focus.size())));
        return join(parts);
    }

    public double industryMatch(String industry, List<String> preferred) {
        String ind = lower(industry);
        if (ind.isEmpty() || preferred == null || preferred.isEmpty()) {
            return 0.0;
        }
        for (String pref : preferred) {
            if (ind.equals(lower(pref))) {
                return EXACT;
            }
        }
        Set<String> indTokens = tokens(ind);
        List<String> related = rules.relatedIndustries(ind);
        for (String raw : preferred) {
            String pref = lower(raw);
            if (pref.isEmpty()) {
                continue;
            }
            if (ind.contains(pref) || pref.contains(ind)) {
                return PARTIAL;
            }
            Set<String> shared = tokens(pref);
            shared.retainAll(indTokens);
            if (!shared.isEmpty()) {
                return PARTIAL;
            }
            if (related.contains(pref) || rules.relatedIndustries(pref).contains(ind)) {
                return PARTIAL;
            }
        }
        return 0.0;
    }

    /**
     * Explicit funding stage when it can be read, otherwise a stage mentioned in the description.
     */
    public String resolveStage(CompanyProfile candidate) {
        String explicit = rules.canonicalStage(candidate.fundingStage);
        if (explicit.isEmpty()) {
            explicit = rules.inferStage(candidate.fundingStage);
        }
        if (!explicit.isEmpty()) {
            return explicit;
        }
        return rules.inferStage(candidate.description);
    }

    public double stageMatch(String stage, List<String> preferred) {
        int rank = rules.stageRank(stage);
        if (rank < 0 || preferred == null || preferred.isEmpty()) {
            return 0.0;
        }
        boolean adjacent = false;
        for (String raw : preferred) {
            String pref = rules.canonicalStage(raw);
            if (pref.isEmpty()) {
                continue;
            }
            if (pref.equals(stage)) {
                return EXACT;
            }
            if (Math.abs(rules.stageRank(pref) - rank) == 1) {
                adjacent = true;
            }
        }
        return adjacent ? PARTIAL : 0.0;
    }

    public double locationMatch(String location, List<String> preferred) {
        String loc = lower(location);
        if (loc.isEmpty() || preferred == null || preferred.isEmpty()) {
            return 0.0;
        }
        for (String pref : preferred) {
            if (loc.equals(lower(pref))) {
                return EXACT;
            }
        }
        String region = rules.regionOf(loc);
        for (String raw : preferred) {
            String pref = lower(raw);
            if (pref.isEmpty()) {
                continue;
            }
            for (String part : loc.split(",")) {
                String p = part.trim();
                if (!p.isEmpty() && p.equals(pref)) {
                    return PARTIAL;
                }
            }
            if (loc.contains(pref) || pref.contains(loc)) {
                return PARTIAL;
            }
            if (!region.isEmpty() && region.equals(rules.regionOf(pref))) {
                return PARTIAL;
            }
        }
        return 0.0;
    }

    /**
     * Average founder network strength rescaled to 0-100.
     */
    public double networkProximity(List<FounderProfile> founders) {
        if (founders == null || founders.isEmpty()) {
            return 0.0;
        }
        double cap = qualityScorer.networkCap();
        if (cap <= 0.0) {
            return 0.0;
        }
        double total = 0.0;
        for (FounderProfile founder : founders) {
            total += qualityScorer.networkScore(founder);
        }
        return QualityScorer.clamp(total / founders.size() * 100.0 / cap, 0.0, 100.0);
    }

    private static Set<String> tokens(String text) {
        Set<String> out = new HashSet<>();
        for (String token : text.split("[^a-z0-9]+")) {
            if (token.length() >= 2) {
                out.add(token);
            }
        }
        return out;
    }

    private static String join(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part.trim());
        }
        return sb.toString();
    }

    private static String lower(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
