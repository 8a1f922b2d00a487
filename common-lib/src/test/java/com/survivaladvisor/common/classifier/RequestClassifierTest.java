package com.survivaladvisor.common.classifier;

import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.GearSlot;
import com.survivaladvisor.common.model.IntentType;
import com.survivaladvisor.common.model.QuestionEntities;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Routing behaviour of {@link RequestClassifier} across its four rule groups.
 */
class RequestClassifierTest {

    // ── explicit AI ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("explicit AI phrases")
    class ExplicitAi {

        @Test
        @DisplayName("\"ai\" as a word overrides a matching gear rule")
        void aiWordOverridesRule() {
            ClassifiedRequest r = RequestClassifier.classify("Ask AI what gear I should push");
            assertEquals(IntentType.AI, r.intentType());
            assertEquals("explicit_ai", r.category());
            assertEquals(1.0, r.confidence());
            assertNull(r.ruleHandler());
        }

        @Test
        @DisplayName("claude → AI even for a lineup question")
        void claudeOverridesLineup() {
            ClassifiedRequest r = RequestClassifier.classify("Can Claude build my bear trap lineup?");
            assertEquals(IntentType.AI, r.intentType());
            assertEquals(1.0, r.confidence());
        }

        @Test
        @DisplayName("\"ai\" inside another word is not explicit")
        void aiInsideWordIgnored() {
            ClassifiedRequest r = RequestClassifier.classify("what should i upgrade after the rain event");
            assertEquals(IntentType.RULES, r.intentType());
        }
    }

    // ── contextual reasoning ───────────────────────────────────────────────

    @Nested
    @DisplayName("contextual reasoning → AI")
    class Contextual {

        @Test
        @DisplayName("ring vs amulet → AI comparison")
        void ringVsAmulet() {
            ClassifiedRequest r = RequestClassifier.classify("ring vs amulet");
            assertEquals(IntentType.AI, r.intentType());
            assertEquals("comparison", r.category());
        }

        @Test
        @DisplayName("versus → AI comparison")
        void versus() {
            assertEquals("comparison",
                RequestClassifier.classify("Jeronimo versus Natalia for garrison").category());
        }

        @Test
        @DisplayName("what if → hypothetical")
        void hypothetical() {
            ClassifiedRequest r = RequestClassifier.classify("What if I skip gen 2 heroes?");
            assertEquals(IntentType.AI, r.intentType());
            assertEquals("hypothetical", r.category());
            assertEquals(0.95, r.confidence());
        }

        @Test
        @DisplayName("why → explanation")
        void explanation() {
            assertEquals("explanation",
                RequestClassifier.classify("why is coat upgraded first").category());
        }
    }

    // ── deterministic rules ────────────────────────────────────────────────

    @Nested
    @DisplayName("deterministic rules")
    class Deterministic {

        @Test
        @DisplayName("what should i upgrade → RULES / hero analyzer")
        void upgradeQuestion() {
            ClassifiedRequest r = RequestClassifier.classify("What should I upgrade?");
            assertEquals(IntentType.RULES, r.intentType());
            assertEquals("upgrade", r.category());
            assertEquals(RuleHandler.HERO_ANALYZER, r.ruleHandler());
            assertEquals(0.9, r.confidence());
        }

        @Test
        @DisplayName("highest confidence wins over an earlier, weaker match")
        void highestConfidenceWins() {
            ClassifiedRequest r = RequestClassifier.classify("upgrade chief gear first");
            assertEquals("gear", r.category());
            assertEquals(RuleHandler.GEAR_ADVISOR, r.ruleHandler());
            assertEquals(0.9, r.confidence());
        }

        @Test
        @DisplayName("exact confidence tie → earlier rule in the list wins")
        void tieBrokenByListOrder() {
            // "best lineup" (lineup, 0.9) is declared before "jessie" (joiner_heroes, 0.9)
            ClassifiedRequest a = RequestClassifier.classify("best lineup with jessie");
            ClassifiedRequest b = RequestClassifier.classify("jessie in my best lineup");
            assertEquals("lineup", a.category());
            assertEquals(RuleHandler.LINEUP_BUILDER, a.ruleHandler());
            assertEquals(a, b);
        }

        @Test
        @DisplayName("confidence below 0.8 → HYBRID")
        void lowConfidenceIsHybrid() {
            ClassifiedRequest shop = RequestClassifier.classify("what to buy in the shop");
            assertEquals(IntentType.HYBRID, shop.intentType());
            assertEquals(RuleHandler.COMBINED, shop.ruleHandler());

            ClassifiedRequest furnace = RequestClassifier.classify("how long until furnace 30");
            assertEquals(IntentType.HYBRID, furnace.intentType());
            assertEquals("progression", furnace.category());
            assertEquals(RuleHandler.PROGRESSION_TRACKER, furnace.ruleHandler());
        }

        @Test
        @DisplayName("confidence of exactly 0.8 stays RULES")
        void thresholdIsExclusive() {
            ClassifiedRequest r = RequestClassifier.classify("early game tips");
            assertEquals(IntentType.RULES, r.intentType());
            assertEquals("phase", r.category());
        }
    }

    // ── totality ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("default and totality")
    class Totality {

        @Test
        @DisplayName("null and empty → AI general 0.5")
        void nullAndEmpty() {
            for (String q : new String[]{null, "", "   "}) {
                ClassifiedRequest r = RequestClassifier.classify(q);
                assertEquals(IntentType.AI, r.intentType());
                assertEquals("general", r.category());
                assertEquals(0.5, r.confidence());
            }
        }

        @Test
        @DisplayName("unmatched text → AI general")
        void unmatched() {
            assertEquals("general", RequestClassifier.classify("hello there chief").category());
        }

        @Test
        @DisplayName("same input → same output")
        void deterministic() {
            String q = "best team for crazy joe";
            assertEquals(RequestClassifier.classify(q), RequestClassifier.classify(q));
        }
    }

    // ── needsAiFallback ────────────────────────────────────────────────────

    @Nested
    @DisplayName("needsAiFallback()")
    class NeedsAiFallback {

        private final List<RecommendationRecord> oneResult = List.of(
            RecommendationRecord.rule(2, RecommendationCategory.GEAR, "Upgrade Coat", "Coat",
                "Infantry first", "", "upgrade_coat", "gear"));

        @Test
        @DisplayName("no rule results → true")
        void emptyResults() {
            assertTrue(RequestClassifier.needsAiFallback(List.of(), "what gear"));
            assertTrue(RequestClassifier.needsAiFallback(null, "what gear"));
        }

        @Test
        @DisplayName("plain question with results → false")
        void plainQuestion() {
            assertFalse(RequestClassifier.needsAiFallback(oneResult, "what gear next"));
        }

        @Test
        @DisplayName("explanation or comparison markers → true")
        void explanationOrComparison() {
            assertTrue(RequestClassifier.needsAiFallback(oneResult, "explain the gear order"));
            assertTrue(RequestClassifier.needsAiFallback(oneResult, "coat or pants"));
            assertTrue(RequestClassifier.needsAiFallback(oneResult, "coat vs pants"));
        }
    }

    // ── extractEntities ────────────────────────────────────────────────────

    @Nested
    @DisplayName("extractEntities()")
    class ExtractEntities {

        @Test
        @DisplayName("heroes, modes and legacy gear names are recognised")
        void mixedQuestion() {
            QuestionEntities e = RequestClassifier.extractEntities(
                "Should Jessie or Wu Ming join bear trap with ring and helmet?");
            assertEquals(List.of("Jessie", "Wu Ming"), e.heroes());
            assertEquals(List.of("bear_trap"), e.gameModes());
            assertEquals(List.of(GearSlot.CAP, GearSlot.BELT), e.gearPieces());
        }

        @Test
        @DisplayName("pve and exploration collapse to one mode")
        void modeAliases() {
            assertEquals(List.of("exploration"),
                RequestClassifier.extractEntities("exploration pve team").gameModes());
        }

        @Test
        @DisplayName("hero names only match whole words")
        void wholeWordsOnly() {
            assertTrue(RequestClassifier.extractEntities("I moved to miami").isEmpty());
        }
    }
}
