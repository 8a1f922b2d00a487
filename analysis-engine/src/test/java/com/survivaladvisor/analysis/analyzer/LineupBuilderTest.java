package com.survivaladvisor.analysis.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.analysis.lineup.GameMode;
import com.survivaladvisor.analysis.scoring.HeroValueScorer;
import com.survivaladvisor.common.exception.UnknownVocabularyException;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.JoinerAdvice;
import com.survivaladvisor.common.model.LineupConfidence;
import com.survivaladvisor.common.model.LineupResult;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.TroopClass;
import com.survivaladvisor.common.reference.ReferenceDataLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LineupBuilderTest {

    private final LineupBuilder builder = new LineupBuilder(
        new HeroValueScorer(new ReferenceDataLoader(new ObjectMapper()).load()));

    // ── buildLineup ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("buildLineup")
    class Build {

        @Test
        @DisplayName("bear trap: preferred lead, best value fills slot 2, missing slot 3 reported")
        void bearTrap() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Jeronimo", HeroState.of(50, 2))
                .hero("Alonso", HeroState.of(40, 1))
                .hero("Molly", HeroState.of(40, 1))
                .build();
            LineupResult lineup = builder.buildLineup(GameMode.BEAR_TRAP, snapshot);

            assertEquals("bear_trap", lineup.gameMode());
            assertEquals("Bear Trap Rally", lineup.modeName());
            assertEquals("Jeronimo", lineup.heroes().get(0).hero());
            assertEquals("Lv50", lineup.heroes().get(0).status());
            assertEquals("Alonso", lineup.heroes().get(1).hero());
            assertEquals("Philly", lineup.heroes().get(2).hero());
            assertFalse(lineup.heroes().get(2).owned());
            assertEquals("Not owned", lineup.heroes().get(2).status());
            assertEquals(LineupConfidence.MEDIUM, lineup.confidence());
            assertEquals(List.of("Philly"), lineup.recommendedToGet());
            assertEquals(90, lineup.troopRatio().get(TroopClass.MARKSMAN));
        }

        @Test
        @DisplayName("a hero never fills two slots")
        void noDuplicates() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Natalia", HeroState.of(50, 2))
                .build();
            LineupResult lineup = builder.buildLineup(GameMode.CRAZY_JOE, snapshot);
            long natalia = lineup.heroes().stream().filter(s -> "Natalia".equals(s.hero()) && s.owned()).count();
            assertEquals(1, natalia);
        }

        @Test
        @DisplayName("joiner slot: preferred joiner beats a stronger hero; fillers take the rest")
        void joinerPreference() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Jeronimo", HeroState.of(30, 1))
                .hero("Jessie", HeroState.of(30, 1))
                .build();
            LineupResult lineup = builder.buildLineup(GameMode.RALLY_JOINER_ATTACK, snapshot);
            assertEquals("Jessie", lineup.heroes().get(0).hero());
            assertEquals("Jeronimo", lineup.heroes().get(1).hero());
            assertEquals("Lv30 (filler)", lineup.heroes().get(1).status());
            assertEquals("Any hero", lineup.heroes().get(2).hero());
            assertEquals("Filler slot", lineup.heroes().get(2).status());
            assertEquals(LineupConfidence.HIGH, lineup.confidence());
        }

        @Test
        @DisplayName("empty roster → low confidence, first preferences to acquire")
        void emptyRoster() {
            LineupResult lineup = builder.buildLineup(GameMode.RALLY_JOINER_ATTACK, PlayerSnapshot.empty());
            assertEquals(LineupConfidence.LOW, lineup.confidence());
            assertEquals(List.of("Jessie"), lineup.recommendedToGet());
        }

        @Test
        @DisplayName("unknown mode name → UnknownVocabularyException")
        void unknownMode() {
            assertThrows(UnknownVocabularyException.class, () -> GameMode.fromName("castle_siege"));
            assertEquals(GameMode.SVS_MARCH, GameMode.fromName("SVS-March"));
        }
    }

    // ── joiners ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("joinerAdvice")
    class Joiners {

        @Test
        @DisplayName("maxed Jessie → ready to join")
        void ready() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Jessie", HeroState.of(50, 3, 5, 1))
                .build();
            JoinerAdvice advice = builder.joinerAdvice(snapshot, true);
            assertEquals("Jessie", advice.hero());
            assertEquals(5, advice.skillLevel());
            assertEquals("Ready to join!", advice.action());
        }

        @Test
        @DisplayName("defense falls back to Natalia")
        void defenseFallback() {
            PlayerSnapshot snapshot = PlayerSnapshot.builder()
                .hero("Natalia", HeroState.of(50, 3, 2, 1))
                .build();
            JoinerAdvice advice = builder.joinerAdvice(snapshot, false);
            assertEquals("Natalia", advice.hero());
            assertEquals("Max Natalia's expedition skill", advice.action());
            assertTrue(advice.criticalNote().contains("Defenders' Edge"));
        }

        @Test
        @DisplayName("no joiner owned → send troops only")
        void none() {
            JoinerAdvice advice = builder.joinerAdvice(PlayerSnapshot.empty(), true);
            assertNull(advice.hero());
            assertFalse(advice.owned());
            assertEquals("REMOVE ALL HEROES when joining attack rallies. Send troops only!", advice.action());
        }
    }

    // ── analyze and questions ──────────────────────────────────────────────

    @Test
    @DisplayName("analyze: joiner records plus gap records for high-priority modes")
    void analyze() {
        List<RecommendationRecord> records = builder.analyze(PlayerSnapshot.empty());
        List<String> ids = records.stream().map(RecommendationRecord::ruleId).toList();
        assertTrue(ids.contains("joiner_attack"));
        assertTrue(ids.contains("joiner_defense"));
        assertTrue(ids.contains("lineup_gap_bear_trap"));
        assertTrue(ids.contains("lineup_gap_svs_march"));
        assertFalse(ids.contains("lineup_gap_exploration"));
        for (int i = 1; i < records.size(); i++) {
            assertTrue(records.get(i - 1).priority() <= records.get(i).priority());
        }
    }

    @Test
    @DisplayName("lineupForQuestion: first mentioned mode, empty when none")
    void forQuestion() {
        Optional<LineupResult> bear = builder.lineupForQuestion("Best lineup for Bear Trap?", PlayerSnapshot.empty());
        assertEquals("bear_trap", bear.orElseThrow().gameMode());
        assertEquals("rally_joiner_defense",
            builder.lineupForQuestion("who do I reinforce with", PlayerSnapshot.empty()).orElseThrow().gameMode());
        assertTrue(builder.lineupForQuestion("hello there", PlayerSnapshot.empty()).isEmpty());
        assertTrue(builder.lineupForQuestion(null, PlayerSnapshot.empty()).isEmpty());
    }
}
