package com.survivaladvisor.common.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.common.model.TroopClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDataLoaderTest {

    private final ReferenceDataLoader loader = new ReferenceDataLoader(new ObjectMapper());

    @AfterEach
    void resetCache() {
        ReferenceDataLoader.clearCache();
    }

    @Test
    @DisplayName("bundled tables load with their full ranges")
    void bundledTables() {
        ReferenceData data = loader.load();
        assertEquals(42, data.maxGearTier());
        assertEquals(16, data.maxCharmLevel());
        assertEquals(90L, data.troopPower(11, TroopClass.LANCER).getAsLong());
        assertTrue(data.heroXpForLevel(79).isPresent());
        assertTrue(data.shardsForStar(5).isPresent());
    }

    @Test
    @DisplayName("hero lookup is case-insensitive; unknown heroes get tier C gen 1")
    void heroLookup() {
        ReferenceData data = loader.load();
        HeroReference jeronimo = data.hero("jeronimo");
        assertEquals(HeroTier.S_PLUS, jeronimo.tier());
        assertEquals(TroopClass.INFANTRY, jeronimo.heroClass());

        HeroReference unknown = data.hero("Nobody");
        assertEquals(HeroTier.C, unknown.tier());
        assertEquals(1, unknown.generation());
        assertTrue(unknown.troopClass().isEmpty());
    }

    @Test
    @DisplayName("war academy edges keyed by from-level; last level has no edge")
    void warAcademyEdges() {
        ReferenceData data = loader.load();
        assertEquals("FC1-1", data.warAcademyEdge("fc1-0").orElseThrow().toLevel());
        assertTrue(data.warAcademyEdge("FC5-3").isEmpty());
    }

    @Test
    @DisplayName("missing base path → empty tables, no exception")
    void missingBasePath() {
        ReferenceData data = loader.load("does-not-exist");
        assertTrue(data.isEmpty());
        assertEquals(HeroTier.C, data.hero("Jeronimo").tier());
    }

    @Test
    @DisplayName("tables are memoized per base path")
    void memoized() {
        assertSame(loader.load("reference"), loader.load("classpath:/reference/"));
    }
}
