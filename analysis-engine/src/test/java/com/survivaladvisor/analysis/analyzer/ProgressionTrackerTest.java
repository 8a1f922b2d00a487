package com.survivaladvisor.analysis.analyzer;

import com.survivaladvisor.common.model.GamePhase;
import com.survivaladvisor.common.model.Milestone;
import com.survivaladvisor.common.model.PhaseInfo;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressionTrackerTest {

    private final ProgressionTracker tracker = new ProgressionTracker();

    private static PlayerSnapshot at(int furnace, int fireCrystal, int age) {
        return PlayerSnapshot.builder().furnaceLevel(furnace).fireCrystalLevel(fireCrystal).stateAgeDays(age).build();
    }

    // ── phase detection ────────────────────────────────────────────────────

    @Nested
    @DisplayName("detectPhase")
    class Detect {

        @Test
        @DisplayName("furnace 32, no fire crystal → LATE_GAME")
        void furnace32() {
            assertEquals(GamePhase.LATE_GAME, tracker.detectPhase(at(32, 0, 0)));
        }

        @Test
        @DisplayName("fire crystal 5 → ENDGAME; any fire crystal → LATE_GAME")
        void fireCrystal() {
            assertEquals(GamePhase.ENDGAME, tracker.detectPhase(at(30, 5, 400)));
            assertEquals(GamePhase.LATE_GAME, tracker.detectPhase(at(25, 1, 10)));
        }

        @Test
        @DisplayName("furnace 19 or state age 55 → MID_GAME")
        void mid() {
            assertEquals(GamePhase.MID_GAME, tracker.detectPhase(at(19, 0, 0)));
            assertEquals(GamePhase.MID_GAME, tracker.detectPhase(at(10, 0, 55)));
        }

        @Test
        @DisplayName("default snapshot → EARLY_GAME")
        void early() {
            assertEquals(GamePhase.EARLY_GAME, tracker.detectPhase(PlayerSnapshot.empty()));
            assertEquals(GamePhase.EARLY_GAME, tracker.detectPhase(at(18, 0, 54)));
        }
    }

    // ── tips ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("three focus tips then two warnings")
    void tips() {
        List<RecommendationRecord> records = tracker.analyze(PlayerSnapshot.empty());
        assertEquals(5, records.size());
        assertEquals(List.of(2, 3, 4, 4, 4), records.stream().map(RecommendationRecord::priority).toList());
        assertEquals("Rush Furnace to L19 for Daybreak Island", records.get(0).action());
        assertEquals("phase_early_game_focus_0", records.get(0).ruleId());
        assertEquals("Avoid: Spreading hero investment too thin", records.get(3).action());
        assertEquals("phase_early_game_warning", records.get(4).ruleId());
        assertTrue(records.get(3).relevanceTags().contains("warning"));
    }

    // ── milestones and resources ───────────────────────────────────────────

    @Nested
    @DisplayName("nextMilestone")
    class Milestones {

        @Test
        @DisplayName("furnace 5 → Research Center, 4 levels away")
        void furnace() {
            Milestone m = tracker.nextMilestone(at(5, 0, 0));
            assertEquals("furnace", m.type());
            assertEquals("Furnace L9", m.target());
            assertEquals("Research Center", m.name());
            assertEquals(4, m.distance());
        }

        @Test
        @DisplayName("furnace 30 → fire-crystal milestones")
        void fireCrystal() {
            Milestone m = tracker.nextMilestone(at(30, 2, 0));
            assertEquals("fc", m.type());
            assertEquals("FC3", m.target());
            assertEquals(1, m.distance());
        }

        @Test
        @DisplayName("fire crystal 5 → endgame optimization")
        void endgame() {
            Milestone m = tracker.nextMilestone(at(30, 5, 0));
            assertEquals("endgame", m.type());
            assertEquals("Endgame Optimization", m.name());
            assertEquals(0, m.distance());
        }
    }

    @Test
    @DisplayName("resource priorities follow bottlenecks without duplicates")
    void resources() {
        assertEquals(List.of("Fire Crystals", "Refined Fire Crystals", "FC Speedups", "General Speedups",
            "Essence Stones", "Mithril"), tracker.resourcePriorities(at(30, 0, 0)));
        assertEquals(List.of("General Speedups", "Gems", "Frost Stars", "Refined Fire Crystals"),
            tracker.resourcePriorities(at(30, 6, 0)));
    }

    @Test
    @DisplayName("phaseInfo bundles phase, lists, milestone and resources")
    void phaseInfo() {
        PhaseInfo info = tracker.phaseInfo(at(20, 0, 60));
        assertEquals(GamePhase.MID_GAME, info.phase());
        assertEquals("Mid Game", info.name());
        assertEquals(4, info.focus().size());
        assertEquals("Furnace L25", info.nextMilestone().target());
        assertEquals(7, info.resourcePriorities().size());
    }
}
