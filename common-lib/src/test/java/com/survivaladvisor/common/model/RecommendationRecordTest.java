package com.survivaladvisor.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationRecordTest {

    @Test
    @DisplayName("priority outside 1..5 is rejected")
    void priorityRange() {
        assertThrows(IllegalArgumentException.class, () ->
            RecommendationRecord.rule(0, RecommendationCategory.HERO, "Level Molly", null, "", "", "r"));
        assertThrows(IllegalArgumentException.class, () ->
            RecommendationRecord.rule(6, RecommendationCategory.HERO, "Level Molly", null, "", "", "r"));
    }

    @Test
    @DisplayName("normalized action ignores case and repeated whitespace")
    void normalizedAction() {
        RecommendationRecord a = RecommendationRecord.rule(1, RecommendationCategory.GEAR,
            "  Upgrade   Coat to Legendary ", "Coat", "", "", "upgrade_coat");
        assertEquals("upgrade coat to legendary", a.normalizedAction());
    }

    @Test
    @DisplayName("tags keep insertion order and cannot be modified")
    void tags() {
        RecommendationRecord r = RecommendationRecord.rule(2, RecommendationCategory.LINEUP,
            "Use Jessie", "Jessie", "", "", "joiner", "rally", "joiner", "rally");
        assertEquals(List.of("rally", "joiner"), List.copyOf(r.relevanceTags()));
        assertThrows(UnsupportedOperationException.class, () -> r.relevanceTags().add("x"));
    }

    @Test
    @DisplayName("power upgrades reject negative resource costs")
    void powerUpgradeCost() {
        assertThrows(IllegalArgumentException.class, () -> new PowerUpgrade(UpgradeType.CHIEF_GEAR, "Coat",
            "T1", "T2", 100, 1, Map.of("hardened_alloy", -5L), 0, 1, "", UpgradeConfidence.ESTIMATED, null));
        PowerUpgrade ok = new PowerUpgrade(UpgradeType.CHIEF_GEAR, "Coat", "T1", "T2", 100, 1,
            Map.of("hardened_alloy", 50L, "polishing_solution", 30L), 0, 1, "", UpgradeConfidence.ESTIMATED, null);
        assertEquals(80, ok.totalCost());
    }
}
