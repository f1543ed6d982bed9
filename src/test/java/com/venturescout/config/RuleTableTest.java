package com.venturescout.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleTableTest {

    @Test
    void sum_shouldMatchOnWordBoundaries() {
        RuleTable table = RuleTable.uniform(List.of("lead", "mit", "vice president"), 5);

        assertEquals(0.0, table.sum("Leadership summit"), 1e-9);
        assertEquals(15.0, table.sum("Team lead at MIT, later Vice President"), 1e-9);
        assertEquals(10.0, table.sum("lead; mit"), 1e-9);
        assertFalse(table.anyMatch(null));
    }

    @Test
    void parse_shouldReadPointsSuffixAndFallBackToDefault() {
        RuleTable table = RuleTable.parse(List.of("hackathon winner:7", "olympian", "odd:entry:x"), 10);

        assertEquals(7.0, table.sum("Hackathon winner"), 1e-9);
        assertEquals(10.0, table.sum("Former Olympian"), 1e-9);
        assertEquals(10.0, table.sum("odd:entry:x"), 1e-9);
    }

    @Test
    void keywordRule_shouldRejectBlankPhrase() {
        assertThrows(IllegalArgumentException.class, () -> KeywordRule.of("  ", 1));
    }

    @Test
    void tierTable_shouldPickBestMatchingTier() {
        TierTable atLeast = TierTable.of(TierTable.Mode.AT_LEAST, 3, 8, 10, 15, 1, 4);
        TierTable lessThan = TierTable.of(TierTable.Mode.LESS_THAN, 5, 15, 1, 30, 3, 25);
        TierTable greater = TierTable.of(TierTable.Mode.GREATER_THAN, 100, 4, 1000, 10);

        assertEquals(15.0, atLeast.pointsFor(10), 1e-9);
        assertEquals(8.0, atLeast.pointsFor(9), 1e-9);
        assertEquals(0.0, atLeast.pointsFor(0), 1e-9);
        assertEquals(30.0, lessThan.pointsFor(0), 1e-9);
        assertEquals(25.0, lessThan.pointsFor(2), 1e-9);
        assertEquals(0.0, lessThan.pointsFor(5), 1e-9);
        assertEquals(4.0, greater.pointsFor(1000), 1e-9);
        assertEquals(10.0, greater.pointsFor(1001), 1e-9);
    }

    @Test
    void tierTable_shouldRejectUnpairedValues() {
        assertThrows(IllegalArgumentException.class, () -> TierTable.of(TierTable.Mode.AT_LEAST, 1, 2, 3));
    }

    @Test
    void scoringRules_shouldApplyConfiguredOverrides() {
        Config config = Config.fromConfigurationProperties(null, Map.of(
                "rules", Map.of("top_locations", "Lisbon"),
                "weight", Map.of("quality", Map.of("team", "0"))
        ));

        ScoringRules rules = ScoringRules.fromConfig(config);

        assertTrue(rules.topLocations.anyMatch("Lisbon, Portugal"));
        assertFalse(rules.topLocations.anyMatch("San Francisco"));
        assertEquals(0.0, rules.teamWeight, 1e-9);
        assertEquals(ScoringRules.defaults().founderWeight, rules.founderWeight, 1e-9);
    }
}
