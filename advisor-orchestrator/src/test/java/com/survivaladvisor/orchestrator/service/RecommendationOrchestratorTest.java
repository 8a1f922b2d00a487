package com.survivaladvisor.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.analysis.analyzer.GearAdvisor;
import com.survivaladvisor.analysis.analyzer.HeroAnalyzer;
import com.survivaladvisor.analysis.analyzer.LineupBuilder;
import com.survivaladvisor.analysis.analyzer.ProgressionTracker;
import com.survivaladvisor.analysis.optimizer.PowerOptimizer;
import com.survivaladvisor.analysis.scoring.HeroValueScorer;
import com.survivaladvisor.analysis.service.AnalyzerDispatchService;
import com.survivaladvisor.common.exception.AiServiceException;
import com.survivaladvisor.common.exception.UnknownVocabularyException;
import com.survivaladvisor.common.model.AnswerSource;
import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.IntentType;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.reference.ReferenceData;
import com.survivaladvisor.common.reference.ReferenceDataLoader;
import com.survivaladvisor.orchestrator.ai.AiFailureCategory;
import com.survivaladvisor.orchestrator.ai.AiFallbackClient;
import com.survivaladvisor.orchestrator.ai.AiRequestWindow;
import com.survivaladvisor.orchestrator.logger.AdviceFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationOrchestratorTest {

    private static final ReferenceData DATA = new ReferenceDataLoader(new ObjectMapper()).load();

    /** Hand-written AI collaborator: records every call, answers from a supplier. */
    static final class FakeAiClient implements AiFallbackClient {
        private final boolean available;
        private final Supplier<Mono<String>> response;
        final List<ClassifiedRequest> calls = new ArrayList<>();

        FakeAiClient(boolean available, Supplier<Mono<String>> response) {
            this.available = available;
            this.response = response;
        }

        static FakeAiClient unavailable() {
            return new FakeAiClient(false, () -> Mono.error(new IllegalStateException("must not be called")));
        }

        static FakeAiClient answering(String text) {
            return new FakeAiClient(true, () -> Mono.just(text));
        }

        static FakeAiClient failing(Throwable error) {
            return new FakeAiClient(true, () -> Mono.error(error));
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Mono<String> ask(PlayerSnapshot snapshot, String question, ClassifiedRequest classified,
                                AiRequestWindow window) {
            calls.add(classified);
            return response.get();
        }
    }

    private static RecommendationOrchestrator orchestrator(AiFallbackClient ai) {
        HeroValueScorer scorer = new HeroValueScorer(DATA);
        HeroAnalyzer heroAnalyzer = new HeroAnalyzer(scorer);
        GearAdvisor gearAdvisor = new GearAdvisor();
        LineupBuilder lineupBuilder = new LineupBuilder(scorer);
        ProgressionTracker progressionTracker = new ProgressionTracker();
        AnalyzerDispatchService dispatch = new AnalyzerDispatchService(
            List.of(heroAnalyzer, gearAdvisor, lineupBuilder, progressionTracker));
        return new RecommendationOrchestrator(dispatch, heroAnalyzer, gearAdvisor, lineupBuilder,
            progressionTracker, new PowerOptimizer(DATA), ai, new AdviceFlowLogger());
    }

    private static PlayerSnapshot midGame() {
        return PlayerSnapshot.builder()
            .furnaceLevel(22)
            .stateAgeDays(90)
            .hero("Jeronimo", HeroState.of(35, 2))
            .hero("Molly", HeroState.of(20, 1))
            .hero("Jessie", HeroState.of(15, 1, 2, 1))
            .build();
    }

    // ── getRecommendations ─────────────────────────────────────────────────

    @Nested
    @DisplayName("getRecommendations")
    class Recommendations {

        @Test
        @DisplayName("merged list → non-decreasing priority, unique actions, within limit")
        void sortedUniqueLimited() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable()).getRecommendations(midGame(), 10))
                .assertNext(records -> {
                    assertFalse(records.isEmpty());
                    assertTrue(records.size() <= 10);
                    for (int i = 1; i < records.size(); i++) {
                        assertTrue(records.get(i - 1).priority() <= records.get(i).priority());
                    }
                    Set<String> actions = new HashSet<>();
                    records.forEach(r -> assertTrue(actions.add(r.normalizedAction()), r.action()));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("limit 0 → empty list")
        void zeroLimit() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable()).getRecommendations(midGame(), 0))
                .assertNext(records -> assertTrue(records.isEmpty()))
                .verifyComplete();
        }

        @Test
        @DisplayName("merge: case/whitespace duplicates collapse, equal priorities keep input order")
        void mergeStableDedup() {
            RecommendationRecord a = RecommendationRecord.rule(2, RecommendationCategory.HERO, "Level Molly", null, "", "", "a");
            RecommendationRecord b = RecommendationRecord.rule(1, RecommendationCategory.GEAR, "Push coat", null, "", "", "b");
            RecommendationRecord dup = RecommendationRecord.rule(1, RecommendationCategory.POWER, "  level   MOLLY ", null, "", "", "c");
            RecommendationRecord c = RecommendationRecord.rule(2, RecommendationCategory.LINEUP, "Fix lineup", null, "", "", "d");

            List<RecommendationRecord> merged = RecommendationOrchestrator.merge(List.of(a, b, c), List.of(dup), 10);

            assertEquals(List.of("b", "c", "a", "d"), merged.stream().map(RecommendationRecord::ruleId).toList());
        }
    }

    // ── ask: rule path ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("ask → rules")
    class AskRules {

        @Test
        @DisplayName("deterministic upgrade question → rule answer, AI never called")
        void upgradeQuestion() {
            FakeAiClient ai = FakeAiClient.answering("should not be used");
            StepVerifier.create(orchestrator(ai).ask(midGame(), "What should I upgrade first?", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertEquals("upgrade", answer.category());
                    assertTrue(answer.answer().startsWith("Chief, based on your roster"));
                    assertFalse(answer.recommendations().isEmpty());
                    assertTrue(answer.recommendations().size() <= 5);
                })
                .verifyComplete();
            assertTrue(ai.calls.isEmpty());
        }

        @Test
        @DisplayName("upgrade question with an empty roster → asks for heroes instead of naming one")
        void upgradeQuestionEmptyRoster() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable())
                    .ask(PlayerSnapshot.empty(), "What should I upgrade first?", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertEquals(RuleAnswerBuilder.NO_HEROES, answer.answer());
                    assertFalse(answer.answer().contains("Any"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("bear trap question → lineup attached and described")
        void lineupQuestion() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable())
                    .ask(midGame(), "best lineup for bear trap", false, null))
                .assertNext(answer -> {
                    assertNotNull(answer.lineup());
                    assertEquals("bear_trap", answer.lineup().gameMode());
                    assertTrue(answer.answer().contains("Jeronimo"));
                    assertTrue(answer.answer().contains("Troop composition:"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("furnace question → phase answer names the next milestone")
        void phaseQuestion() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable())
                    .ask(midGame(), "furnace", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertTrue(answer.answer().startsWith("Chief, you're in "));
                    assertTrue(answer.answer().contains("Chief Charms"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("hybrid with comparison marker → AI enhancement attached")
        void hybridEnhanced() {
            FakeAiClient ai = FakeAiClient.answering("Save for the next hero event.");
            StepVerifier.create(orchestrator(ai).ask(midGame(), "what to buy or save", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertEquals("shop", answer.category());
                    assertEquals("Save for the next hero event.", answer.aiEnhancement());
                })
                .verifyComplete();
            assertEquals(1, ai.calls.size());
            assertEquals(IntentType.HYBRID, ai.calls.get(0).intentType());
        }

        @Test
        @DisplayName("hybrid enhancement failure → plain rule answer")
        void hybridEnhancementFails() {
            FakeAiClient ai = FakeAiClient.failing(new AiServiceException("boom"));
            StepVerifier.create(orchestrator(ai).ask(midGame(), "what to buy or save", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertNull(answer.aiEnhancement());
                    assertFalse(answer.answer().isBlank());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("hybrid without explanation or comparison → no AI call")
        void hybridNotEnhanced() {
            FakeAiClient ai = FakeAiClient.answering("unused");
            StepVerifier.create(orchestrator(ai).ask(midGame(), "what to buy", false, null))
                .assertNext(answer -> assertNull(answer.aiEnhancement()))
                .verifyComplete();
            assertTrue(ai.calls.isEmpty());
        }
    }

    // ── ask: AI path ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("ask → AI")
    class AskAi {

        @Test
        @DisplayName("contextual question → AI answer")
        void aiAnswer() {
            FakeAiClient ai = FakeAiClient.answering("Skip it and save shards.");
            StepVerifier.create(orchestrator(ai).ask(midGame(), "what if I skip gen 3 heroes", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.AI, answer.source());
                    assertEquals("hypothetical", answer.category());
                    assertEquals("Skip it and save shards.", answer.answer());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("forceAi with AI unavailable → non-empty rule answer, no error")
        void forceAiUnavailable() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable())
                    .ask(PlayerSnapshot.empty(), "What should I upgrade first?", true, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertFalse(answer.answer().isBlank());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("auth failure → ERROR answer with configuration message")
        void configurationError() {
            FakeAiClient ai = FakeAiClient.failing(new AiServiceException("API key rejected"));
            StepVerifier.create(orchestrator(ai).ask(midGame(), "explain the meta", true, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.ERROR, answer.source());
                    assertEquals(AiFailureCategory.CONFIGURATION.userMessage(), answer.answer());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("timeout → degrades to the rule path")
        void timeoutDegrades() {
            FakeAiClient ai = FakeAiClient.failing(new TimeoutException("Did not observe any item"));
            StepVerifier.create(orchestrator(ai).ask(midGame(), "best lineup for crazy joe", true, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertNotNull(answer.lineup());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("blank AI text → ERROR answer, never empty")
        void blankAnswer() {
            FakeAiClient ai = FakeAiClient.answering("   ");
            StepVerifier.create(orchestrator(ai).ask(midGame(), "help me think about SvS", false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.ERROR, answer.source());
                    assertEquals(AiFailureCategory.UNAVAILABLE.userMessage(), answer.answer());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("AI completes empty → static default")
        void emptyAi() {
            FakeAiClient ai = new FakeAiClient(true, Mono::empty);
            StepVerifier.create(orchestrator(ai).ask(midGame(), "claude, anything new?", false, null))
                .assertNext(answer -> assertEquals(RuleAnswerBuilder.STATIC_DEFAULT, answer.answer()))
                .verifyComplete();
        }

        @Test
        @DisplayName("null question and snapshot → general rule answer")
        void nullInputs() {
            StepVerifier.create(orchestrator(FakeAiClient.unavailable()).ask(null, null, false, null))
                .assertNext(answer -> {
                    assertEquals(AnswerSource.RULES, answer.source());
                    assertEquals(RuleAnswerBuilder.GENERAL, answer.answer());
                })
                .verifyComplete();
        }
    }

    // ── views ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("unknown mode or spender tier → UnknownVocabularyException")
    void unknownVocabulary() {
        RecommendationOrchestrator orchestrator = orchestrator(FakeAiClient.unavailable());
        assertThrows(UnknownVocabularyException.class, () -> orchestrator.getLineup("castle_siege", midGame()));
        assertThrows(UnknownVocabularyException.class, () -> orchestrator.getGearPriority("kraken"));
    }

    @Test
    @DisplayName("views delegate to the analyzers")
    void views() {
        RecommendationOrchestrator orchestrator = orchestrator(FakeAiClient.unavailable());
        assertEquals(8, orchestrator.getGearPriority("f2p").size());
        assertEquals("garrison", orchestrator.getLineup("garrison", midGame()).gameMode());
        assertNotNull(orchestrator.getPhaseInfo(midGame()).nextMilestone());
        assertFalse(orchestrator.getHeroInvestments(midGame(), 3).isEmpty());
        assertTrue(orchestrator.getPowerRecommendations(midGame(), 4).size() <= 4);
        assertEquals(IntentType.AI, orchestrator.classify("").intentType());
    }
}
