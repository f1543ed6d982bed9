package com.venturescout.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference tables and caps used by the quality scorer. Built once per process and shared
 * read-only between worker threads.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScoringRules {
    public final RuleTable prestigiousCompanies;
    public final RuleTable relevantKeywords;
    public final TierTable yearsTiers;
    public final double experienceCap;

    public final RuleTable prestigiousUniversities;
    public final RuleTable advancedDegrees;
    public final RuleTable relevantFields;
    public final double educationCap;

    public final RuleTable honors;
    public final double doctoralBonus;
    public final double honorsCap;

    public final TierTable connectionTiers;
    public final TierTable endorsementTiers;
    public final double networkCap;

    public final RuleTable founderTitles;
    public final RuleTable relevantTitles;
    public final double founderTitlePoints;
    public final double relevantTitlePoints;

    public final double founderCap;

    public final TierTable descriptionTiers;
    public final RuleTable industryKeywords;
    public final double industryBonus;
    public final RuleTable topLocations;
    public final double locationBonus;
    public final TierTable ageTiers;

    public final double soloTeamPoints;
    public final double coreTeamPoints;
    public final double largeTeamPoints;
    public final int largeTeamSize;
    public final TierTable diversityTiers;
    public final double coreRolesBonus;

    public final double founderWeight;
    public final double companyWeight;
    public final double teamWeight;

    public static ScoringRules defaults() {
        return DEFAULTS;
    }

    /**
     * Defaults with every {@code rules.*} list and {@code weight.quality.*} value found in the
     * configuration applied on top.
     */
    public static ScoringRules fromConfig(Config config) {
        if (config == null) {
            return DEFAULTS;
        }
        ScoringRulesBuilder builder = DEFAULTS.toBuilder();
        List<String> companies = config.getList("rules.prestigious_companies");
        if (!companies.isEmpty()) {
            builder.prestigiousCompanies(RuleTable.uniform(companies, 12));
        }
        List<String> keywords = config.getList("rules.relevant_keywords");
        if (!keywords.isEmpty()) {
            builder.relevantKeywords(RuleTable.uniform(keywords, 5));
        }
        List<String> universities = config.getList("rules.prestigious_universities");
        if (!universities.isEmpty()) {
            builder.prestigiousUniversities(RuleTable.uniform(universities, 12));
        }
        List<String> degrees = config.getList("rules.advanced_degrees");
        if (!degrees.isEmpty()) {
            builder.advancedDegrees(RuleTable.uniform(degrees, 8));
        }
        List<String> fields = config.getList("rules.relevant_fields");
        if (!fields.isEmpty()) {
            builder.relevantFields(RuleTable.uniform(fields, 3));
        }
        List<String> honors = config.getList("rules.honors");
        if (!honors.isEmpty()) {
            builder.honors(RuleTable.parse(honors, 10));
        }
        List<String> industries = config.getList("rules.industry_keywords");
        if (!industries.isEmpty()) {
            builder.industryKeywords(RuleTable.uniform(industries, 1));
        }
        List<String> locations = config.getList("rules.top_locations");
        if (!locations.isEmpty()) {
            builder.topLocations(RuleTable.uniform(locations, 1));
        }
        builder.founderWeight(Math.max(0.0, config.getDouble("weight.quality.founder", DEFAULTS.founderWeight)));
        builder.companyWeight(Math.max(0.0, config.getDouble("weight.quality.company", DEFAULTS.companyWeight)));
        builder.teamWeight(Math.max(0.0, config.getDouble("weight.quality.team", DEFAULTS.teamWeight)));
        return builder.build();
    }

    private static final ScoringRules DEFAULTS = ScoringRules.builder()
            .prestigiousCompanies(RuleTable.uniform(List.of(
                    "google", "facebook", "meta", "amazon", "apple", "microsoft", "netflix",
                    "uber", "airbnb", "stripe", "square", "palantir", "tesla", "spacex",
                    "linkedin", "twitter", "snapchat", "instagram", "whatsapp", "zoom",
                    "salesforce", "oracle", "adobe", "intel", "nvidia", "amd", "cisco",
                    "goldman sachs", "mckinsey", "bain", "bcg", "deloitte", "pwc"), 12))
            .relevantKeywords(RuleTable.uniform(List.of(
                    "founder", "co-founder", "ceo", "cto", "startup", "entrepreneur",
                    "director", "manager", "lead", "senior", "principal", "architect",
                    "vp", "vice president", "head of", "chief", "executive", "engineering",
                    "leadership", "leader"), 5))
            .yearsTiers(TierTable.of(TierTable.Mode.AT_LEAST, 10, 20, 5, 15, 3, 10, 1, 5))
            .experienceCap(35)
            .prestigiousUniversities(RuleTable.uniform(List.of(
                    "stanford", "harvard", "mit", "berkeley", "caltech", "princeton",
                    "yale", "columbia", "upenn", "cornell", "brown", "dartmouth",
                    "duke", "northwestern", "chicago", "nyu", "usc", "ucla", "ucsd",
                    "oxford", "cambridge", "imperial", "lse", "eth zurich", "tsinghua"), 12))
            .advancedDegrees(RuleTable.uniform(List.of(
                    "phd", "ph.d", "doctorate", "mba", "master", "masters", "m.s", "m.a", "md"), 8))
            .relevantFields(RuleTable.uniform(List.of(
                    "computer science", "engineering", "business", "economics",
                    "mathematics", "physics", "chemistry", "biology", "medicine",
                    "data science", "statistics", "finance", "marketing"), 3))
            .educationCap(20)
            .honors(RuleTable.weighted(defaultHonors()))
            .doctoralBonus(10)
            .honorsCap(30)
            .connectionTiers(TierTable.of(TierTable.Mode.GREATER_THAN, 1000, 10, 500, 8, 200, 6, 100, 4))
            .endorsementTiers(TierTable.of(TierTable.Mode.GREATER_THAN, 50, 5, 20, 4, 10, 3))
            .networkCap(15)
            .founderTitles(RuleTable.uniform(List.of(
                    "founder", "co-founder", "cofounder", "ceo", "cto", "cpo", "cmo", "cfo", "coo",
                    "president", "chief executive", "chief technology", "chief product",
                    "chief marketing", "chief financial", "chief operating", "chief data",
                    "chief revenue", "chief growth", "chief strategy", "chief innovation"), 1))
            .relevantTitles(RuleTable.uniform(List.of(
                    "director", "manager", "lead", "senior", "principal",
                    "architect", "engineer", "scientist", "researcher"), 1))
            .founderTitlePoints(15)
            .relevantTitlePoints(8)
            .founderCap(100)
            .descriptionTiers(TierTable.of(TierTable.Mode.GREATER_THAN, 500, 50, 200, 35, 100, 20))
            .industryKeywords(RuleTable.uniform(List.of(
                    "fintech", "healthtech", "ai", "ml", "saas", "e-commerce", "marketplace",
                    "mobile", "software", "technology", "biotech", "cleantech", "edtech"), 1))
            .industryBonus(20)
            .topLocations(RuleTable.uniform(List.of(
                    "san francisco", "new york", "austin", "boston",
                    "seattle", "los angeles", "chicago", "miami"), 1))
            .locationBonus(15)
            .ageTiers(TierTable.of(TierTable.Mode.LESS_THAN, 1, 35, 3, 30, 5, 20))
            .soloTeamPoints(35)
            .coreTeamPoints(40)
            .largeTeamPoints(25)
            .largeTeamSize(5)
            .diversityTiers(TierTable.of(TierTable.Mode.AT_LEAST, 3, 40, 2, 35, 1, 30))
            .coreRolesBonus(25)
            .founderWeight(0.4)
            .companyWeight(0.35)
            .teamWeight(0.25)
            .build();

    private static Map<String, Integer> defaultHonors() {
        Map<String, Integer> honors = new LinkedHashMap<>();
        // academic
        honors.put("rhodes scholar", 25);
        honors.put("marshall scholar", 25);
        honors.put("fulbright scholar", 20);
        honors.put("gates cambridge", 20);
        honors.put("truman scholar", 18);
        honors.put("goldwater scholar", 15);
        honors.put("churchill scholar", 20);
        honors.put("mitchell scholar", 18);
        honors.put("schwarzman scholar", 20);
        honors.put("knight-hennessy", 25);
        // accelerators
        honors.put("y combinator", 30);
        honors.put("techstars", 15);
        honors.put("500 startups", 12);
        honors.put("startup chile", 10);
        honors.put("masschallenge", 8);
        honors.put("founder institute", 5);
        // fellowships and lists
        honors.put("kleiner perkins fellow", 25);
        honors.put("kp fellow", 25);
        honors.put("greylock fellow", 25);
        honors.put("sequoia scout", 20);
        honors.put("first round fellow", 20);
        honors.put("a16z scout", 20);
        honors.put("thiel fellow", 30);
        honors.put("thiel fellowship", 30);
        honors.put("forbes 30 under 30", 20);
        honors.put("fortune 40 under 40", 18);
        honors.put("inc 30 under 30", 15);
        // research
        honors.put("turing award", 50);
        honors.put("nobel prize", 50);
        honors.put("macarthur fellow", 35);
        honors.put("sloan fellow", 25);
        honors.put("packard fellow", 25);
        honors.put("guggenheim fellow", 20);
        honors.put("nsf graduate fellow", 15);
        honors.put("published in nature", 20);
        honors.put("published in science", 20);
        honors.put("ieee", 10);
        honors.put("acm", 10);
        // service
        honors.put("west point", 20);
        honors.put("naval academy", 20);
        honors.put("air force academy", 20);
        honors.put("white house fellow", 25);
        honors.put("presidential innovation fellow", 20);
        // product programs
        honors.put("google apm", 20);
        honors.put("google associate product manager", 20);
        honors.put("facebook rotational product manager", 18);
        // inventions
        honors.put("patent", 10);
        honors.put("patents", 10);
        honors.put("inventor", 12);
        return honors;
    }
}
