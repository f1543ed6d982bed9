package com.venturescout.scoring;

import com.venturescout.config.Config;
import com.venturescout.config.RuleTable;
import com.venturescout.config.ScoringRules;
import com.venturescout.model.CompanyProfile;
import com.venturescout.model.FounderProfile;
import com.venturescout.model.FounderQualityScore;
import com.venturescout.model.QualityScore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic quality of a company and its founders on a 0-100 scale. Stateless apart from its
 * immutable rule tables, so one instance is shared by all batch workers.
 */
public final class QualityScorer {
    private static final Logger log = LogManager.getLogger(QualityScorer.class);

    private static final Pattern YEARS_PATTERN = Pattern.compile("(\\d{1,2})\\s*\\+?\\s*(?:years?|yrs?)\\b");

    enum Role {
        CEO,
        CTO,
        PRODUCT,
        OPERATIONS,
        FINANCE,
        CO_FOUNDER
    }

    private static final Map<Role, RuleTable> ROLE_KEYWORDS = buildRoleKeywords();
    private static final RuleTable CO_FOUNDER_KEYWORDS = RuleTable.uniform(List.of("co-founder", "cofounder", "co founder"), 1);
    private static final RuleTable FOUNDER_KEYWORD = RuleTable.uniform(List.of("founder", "founding"), 1);
    private static final Set<Role> CORE_ROLES = EnumSet.of(Role.CEO, Role.CTO, Role.CO_FOUNDER);

    private final ScoringRules rules;
    private final Clock clock;

    public QualityScorer() {
        this(ScoringRules.defaults(), Clock.systemDefaultZone());
    }

    public QualityScorer(Config config) {
        this(ScoringRules.fromConfig(config), Clock.systemDefaultZone());
    }

    public QualityScorer(ScoringRules rules, Clock clock) {
        this.rules = rules == null ? ScoringRules.defaults() : rules;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    /**
     * A company without founders scores 0 overall. Internal errors are logged and also give 0.
     */
    public QualityScore score(CompanyProfile company) {
        if (company == null || company.founders.isEmpty()) {
            return QualityScore.zero();
        }
        try {
            List<FounderQualityScore> founderScores = new ArrayList<>();
            double founderTotal = 0.0;
            for (FounderProfile founder : company.founders) {
                FounderQualityScore fs = scoreFounder(founder);
                founderScores.add(fs);
                founderTotal += fs.total();
            }
            double founderAverage = round2(founderTotal / founderScores.size());
            double companyScore = companyScore(company);
            double team = teamCompleteness(company.founders);

            double wf = rules.founderWeight;
            double wc = rules.companyWeight;
            double wt = rules.teamWeight;
            double sum = wf + wc + wt;
            double overall = sum <= 0.0
                    ? 0.0
                    : (founderAverage * wf + companyScore * wc + team * wt) / sum;
            return new QualityScore(round2(clamp(overall, 0.0, 100.0)), founderAverage, companyScore, team, founderScores);
        } catch (RuntimeException e) {
            log.error("quality scoring failed company={} err={}", company.name, e.toString());
            return QualityScore.zero();
        }
    }

    public FounderQualityScore scoreFounder(FounderProfile founder) {
        if (founder == null) {
            return new FounderQualityScore("", 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
        double experience = experienceScore(founder.experience);
        double education = educationScore(founder.education);
        double honors = honorsScore(founder);
        double network = networkScore(founder);
        double title = titleRelevance(founder.title);
        double total = Math.min(rules.founderCap, experience + education + honors + network);
        return new FounderQualityScore(founder.name, experience, education, honors, network, title, round2(total));
    }

    public double experienceScore(String experience) {
        if (experience == null || experience.isBlank()) {
            return 0.0;
        }
        double score = rules.prestigiousCompanies.sum(experience)
                + rules.relevantKeywords.sum(experience)
                + rules.yearsTiers.pointsFor(maxYears(experience));
        return Math.min(rules.experienceCap, score);
    }

    public double educationScore(String education) {
        if (education == null || education.isBlank()) {
            return 0.0;
        }
        double score = rules.prestigiousUniversities.sum(education)
                + rules.advancedDegrees.sum(education)
                + rules.relevantFields.sum(education);
        return Math.min(rules.educationCap, score);
    }

    public double honorsScore(FounderProfile founder) {
        String text = String.join(" ", founder.experience, founder.education, founder.honors);
        double score = rules.honors.sum(text);
        if (hasDoctoralMarker(founder)) {
            score += rules.doctoralBonus;
        }
        return Math.min(rules.honorsCap, score);
    }

    /**
     * Network strength on a 0-15 scale from connection and endorsement counts.
     */
    public double networkScore(FounderProfile founder) {
        if (founder == null) {
            return 0.0;
        }
        double score = rules.connectionTiers.pointsFor(founder.linkedinConnections)
                + rules.endorsementTiers.pointsFor(founder.endorsements);
        return Math.min(rules.networkCap, score);
    }

    public double networkCap() {
        return rules.networkCap;
    }

    /**
     * Reported per founder but not part of the founder total.
     */
    public double titleRelevance(String title) {
        if (title == null || title.isBlank()) {
            return 0.0;
        }
        if (rules.founderTitles.anyMatch(title)) {
            return rules.founderTitlePoints;
        }
        if (rules.relevantTitles.anyMatch(title)) {
            return rules.relevantTitlePoints;
        }
        return 0.0;
    }

    public double companyScore(CompanyProfile company) {
        double score = rules.descriptionTiers.pointsFor(company.description.length());
        if (rules.industryKeywords.anyMatch(company.industry)) {
            score += rules.industryBonus;
        }
        if (rules.topLocations.anyMatch(company.location)) {
            score += rules.locationBonus;
        }
        if (company.foundedYear > 0) {
            int age = Year.now(clock).getValue() - company.foundedYear;
            if (age >= 0) {
                score += rules.ageTiers.pointsFor(age);
            }
        }
        return Math.min(100.0, score);
    }

    public double teamCompleteness(List<FounderProfile> founders) {
        if (founders == null || founders.isEmpty()) {
            return 0.0;
        }
        int count = founders.size();
        double score;
        if (count == 1) {
            score = rules.soloTeamPoints;
        } else if (count < rules.largeTeamSize) {
            score = rules.coreTeamPoints;
        } else {
            score = rules.largeTeamPoints;
        }

        Set<Role> roles = EnumSet.noneOf(Role.class);
        for (FounderProfile founder : founders) {
            Role role = classify(founder.title);
            if (role != null) {
                roles.add(role);
            }
            if (CO_FOUNDER_KEYWORDS.anyMatch(founder.title)) {
                roles.add(Role.CO_FOUNDER);
            }
        }
        Set<Role> functional = EnumSet.noneOf(Role.class);
        functional.addAll(roles);
        functional.remove(Role.CO_FOUNDER);
        score += rules.diversityTiers.pointsFor(functional.size());
        if (roles.containsAll(CORE_ROLES)) {
            score += rules.coreRolesBonus;
        }
        return Math.min(100.0, score);
    }

    /**
     * First role whose keywords match the title; a bare founder title counts as CEO.
     */
    static Role classify(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        for (Map.Entry<Role, RuleTable> entry : ROLE_KEYWORDS.entrySet()) {
            if (entry.getValue().anyMatch(title)) {
                return entry.getKey();
            }
        }
        if (FOUNDER_KEYWORD.anyMatch(title) || CO_FOUNDER_KEYWORDS.anyMatch(title)) {
            return Role.CEO;
        }
        return null;
    }

    static int maxYears(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher m = YEARS_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        int max = 0;
        while (m.find()) {
            try {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            } catch (NumberFormatException e) {
                log.debug("unreadable years value={}", m.group(1));
            }
        }
        return max;
    }

    private static boolean hasDoctoralMarker(FounderProfile founder) {
        String name = founder.name.toLowerCase(Locale.ROOT);
        String title = founder.title.toLowerCase(Locale.ROOT);
        return name.startsWith("dr.") || name.startsWith("dr ")
                || name.contains(" dr.")
                || title.contains("dr.")
                || name.contains("ph.d") || title.contains("ph.d");
    }

    private static Map<Role, RuleTable> buildRoleKeywords() {
        Map<Role, RuleTable> map = new EnumMap<>(Role.class);
        map.put(Role.CEO, RuleTable.uniform(List.of("ceo", "chief executive", "president"), 1));
        map.put(Role.CTO, RuleTable.uniform(List.of("cto", "chief technology", "technical", "engineering", "tech"), 1));
        map.put(Role.PRODUCT, RuleTable.uniform(List.of("cpo", "product", "design"), 1));
        map.put(Role.OPERATIONS, RuleTable.uniform(List.of("coo", "operations", "chief operating"), 1));
        map.put(Role.FINANCE, RuleTable.uniform(List.of("cfo", "finance", "chief financial"), 1));
        return map;
    }

    static double clamp(double value, double min, double max) {
        if (!Double.isFinite(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
