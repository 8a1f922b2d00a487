package com.survivaladvisor.analysis.service;

import com.survivaladvisor.analysis.analyzer.RuleAnalyzer;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerDispatchServiceTest {

    private static RuleAnalyzer fixed(String name, RuleHandler handler, String... actions) {
        return new RuleAnalyzer() {
            @Override
            public List<RecommendationRecord> analyze(PlayerSnapshot snapshot) {
                return Arrays.stream(actions)
                    .map(a -> RecommendationRecord.rule(3, RecommendationCategory.HERO, a, null, "", "", name))
                    .toList();
            }
            @Override public String analyzerName() { return name; }
            @Override public RuleHandler handler() { return handler; }
        };
    }

    private static RuleAnalyzer failing() {
        return new RuleAnalyzer() {
            @Override
            public List<RecommendationRecord> analyze(PlayerSnapshot snapshot) {
                throw new IllegalStateException("boom");
            }
            @Override public String analyzerName() { return "Broken"; }
            @Override public RuleHandler handler() { return RuleHandler.GEAR_ADVISOR; }
        };
    }

    private final AnalyzerDispatchService service = new AnalyzerDispatchService(List.of(
        fixed("Hero", RuleHandler.HERO_ANALYZER, "h1", "h2"),
        failing(),
        fixed("Progress", RuleHandler.PROGRESSION_TRACKER, "p1")));

    @Test
    @DisplayName("all analyzers in order; a failing analyzer contributes nothing")
    void dispatchAll() {
        StepVerifier.create(service.dispatchAll(PlayerSnapshot.empty()))
            .assertNext(records -> assertEquals(List.of("h1", "h2", "p1"),
                records.stream().map(RecommendationRecord::action).toList()))
            .verifyComplete();
    }

    @Test
    @DisplayName("single handler → only that analyzer; COMBINED → all")
    void dispatchHandler() {
        StepVerifier.create(service.dispatch(RuleHandler.PROGRESSION_TRACKER, PlayerSnapshot.empty()))
            .assertNext(records -> assertEquals(1, records.size()))
            .verifyComplete();
        StepVerifier.create(service.dispatch(RuleHandler.COMBINED, PlayerSnapshot.empty()))
            .assertNext(records -> assertEquals(3, records.size()))
            .verifyComplete();
    }
}
