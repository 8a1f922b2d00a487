package com.survivaladvisor.analysis.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.reference.HeroTier;
import com.survivaladvisor.common.reference.ReferenceDataLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeroValueScorerTest {

    private final HeroValueScorer scorer =
        new HeroValueScorer(new ReferenceDataLoader(new ObjectMapper()).load());

    // ── generation timeline ────────────────────────────────────────────────

    @Nested
    @DisplayName("GenerationTimeline")
    class Timeline {

        @Test
        @DisplayName("state age → released generation")
        void currentGeneration() {
            assertEquals(1, GenerationTimeline.currentGeneration(0));
            assertEquals(1, GenerationTimeline.currentGeneration(-5));
            assertEquals(2, GenerationTimeline.currentGeneration(40));
            assertEquals(2, GenerationTimeline.currentGeneration(119));
            assertEquals(3, GenerationTimeline.currentGeneration(120));
            assertEquals(8, GenerationTimeline.currentGeneration(520));
            assertEquals(8, GenerationTimeline.currentGeneration(5000));
        }

        @Test
        @DisplayName("relevance decays with the generation gap")
        void decay() {
            assertEquals(1.0, GenerationTimeline.relevance(3, 3, HeroTier.A));
            assertEquals(1.0, GenerationTimeline.relevance(4, 3, HeroTier.A));
            assertEquals(0.9, GenerationTimeline.relevance(2, 3, HeroTier.A));
            assertEquals(0.7, GenerationTimeline.relevance(1, 3, HeroTier.A));
            assertEquals(0.5, GenerationTimeline.relevance(1, 4, HeroTier.A));
            assertEquals(0.3, GenerationTimeline.relevance(1, 7, HeroTier.A));
        }

        @Test
        @DisplayName("S+ boost applies up to three generations back, capped at 1.0")
        void sPlusBoost() {
            assertEquals(1.0, GenerationTimeline.relevance(1, 2, HeroTier.S_PLUS));
            assertEquals(0.85, GenerationTimeline.relevance(1, 3, HeroTier.S_PLUS), 1e-9);
            assertEquals(0.65, GenerationTimeline.relevance(1, 4, HeroTier.S_PLUS), 1e-9);
            assertEquals(0.3, GenerationTimeline.relevance(1, 5, HeroTier.S_PLUS));
        }
    }

    // ── hero value ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("value")
    class Value {

        @Test
        @DisplayName("skill score grows to 0.2 at all skills maxed")
        void skillScore() {
            HeroState base = HeroState.of(10, 0);
            HeroState maxed = new HeroState(80, 5, List.of(5, 5, 5), List.of(5, 5, 5), null);
            assertEquals(0.04, scorer.skillScore(base), 1e-9);
            assertEquals(HeroValueScorer.MAX_SKILL_SCORE, scorer.skillScore(maxed), 1e-9);
            assertEquals(0.0, scorer.skillScore(null));
        }

        @Test
        @DisplayName("value = tier × relevance + skill")
        void formula() {
            assertEquals(1.04, scorer.value("Jeronimo", HeroState.of(10, 0), 1), 1e-9);
            assertEquals(0.54, scorer.value("Molly", HeroState.of(10, 0), 1), 1e-9);
        }

        @Test
        @DisplayName("owned heroes ranked by value, best first")
        void rankOwned() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Molly", HeroState.of(30, 1))
                .hero("Natalia", HeroState.of(30, 1))
                .hero("Jeronimo", HeroState.of(30, 1))
                .build();
            assertEquals(List.of("Jeronimo", "Natalia", "Molly"), scorer.rankOwned(snapshot));
        }

        @Test
        @DisplayName("equal values → name order")
        void tieByName() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Zed", HeroState.of(30, 1))
                .hero("Abe", HeroState.of(30, 1))
                .build();
            assertEquals(List.of("Abe", "Zed"), scorer.rankOwned(snapshot));
        }
    }
}
