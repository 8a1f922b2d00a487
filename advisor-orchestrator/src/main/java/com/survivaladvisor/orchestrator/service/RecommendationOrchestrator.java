package com.survivaladvisor.orchestrator.service;

import com.survivaladvisor.analysis.analyzer.GearAdvisor;
import com.survivaladvisor.analysis.analyzer.HeroAnalyzer;
import com.survivaladvisor.analysis.analyzer.LineupBuilder;
import com.survivaladvisor.analysis.analyzer.ProgressionTracker;
import com.survivaladvisor.analysis.lineup.GameMode;
import com.survivaladvisor.analysis.optimizer.PowerOptimizer;
import com.survivaladvisor.analysis.service.AnalyzerDispatchService;
import com.survivaladvisor.common.classifier.RequestClassifier;
import com.survivaladvisor.common.model.AdvisorAnswer;
import com.survivaladvisor.common.model.AnswerSource;
import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.GearPriorityEntry;
import com.survivaladvisor.common.model.HeroInvestment;
import com.survivaladvisor.common.model.IntentType;
import com.survivaladvisor.common.model.JoinerAdvice;
import com.survivaladvisor.common.model.LineupResult;
import com.survivaladvisor.common.model.PhaseInfo;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.PowerUpgrade;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import com.survivaladvisor.common.model.SpenderTier;
import com.survivaladvisor.common.trace.TraceContextUtil;
import com.survivaladvisor.orchestrator.ai.AiErrorClassifier;
import com.survivaladvisor.orchestrator.ai.AiFailureCategory;
import com.survivaladvisor.orchestrator.ai.AiFallbackClient;
import com.survivaladvisor.orchestrator.ai.AiRequestWindow;
import com.survivaladvisor.orchestrator.logger.AdviceFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point of the engine. Merges analyzer and power-optimizer output into one ranked list
 * and answers free-text questions through the rules or the AI collaborator.
 *
 * <p>{@link #ask} never signals an error and never completes empty: AI failures become an
 * {@code ERROR} answer with a user-facing message, an unconfigured AI or a timeout degrades
 * to the rule path, and anything else ends in a static default.
 */
@Service
public class RecommendationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RecommendationOrchestrator.class);

    public static final int DEFAULT_LIMIT = 10;
    static final int ANSWER_RECORD_LIMIT = 5;
    static final String JOINER_HEROES_CATEGORY = "joiner_heroes";

    private final AnalyzerDispatchService dispatchService;
    private final HeroAnalyzer heroAnalyzer;
    private final GearAdvisor gearAdvisor;
    private final LineupBuilder lineupBuilder;
    private final ProgressionTracker progressionTracker;
    private final PowerOptimizer powerOptimizer;
    private final AiFallbackClient aiClient;
    private final AdviceFlowLogger adviceFlowLogger;

    public RecommendationOrchestrator(AnalyzerDispatchService dispatchService,
                                      HeroAnalyzer heroAnalyzer,
                                      GearAdvisor gearAdvisor,
                                      LineupBuilder lineupBuilder,
                                      ProgressionTracker progressionTracker,
                                      PowerOptimizer powerOptimizer,
                                      AiFallbackClient aiClient,
                                      AdviceFlowLogger adviceFlowLogger) {
        this.dispatchService = dispatchService;
        this.heroAnalyzer = heroAnalyzer;
        this.gearAdvisor = gearAdvisor;
        this.lineupBuilder = lineupBuilder;
        this.progressionTracker = progressionTracker;
        this.powerOptimizer = powerOptimizer;
        this.aiClient = aiClient;
        this.adviceFlowLogger = adviceFlowLogger;
    }

    // ── ranked recommendations ─────────────────────────────────────────────

    /**
     * Analyzer records (hero, gear, lineup, progression) followed by power upgrades, stably
     * sorted by priority, deduplicated on normalized action text (first wins), truncated.
     */
    public Mono<List<RecommendationRecord>> getRecommendations(PlayerSnapshot snapshot, int limit) {
        PlayerSnapshot player = orEmpty(snapshot);
        return dispatchService.dispatchAll(player)
            .map(ruleRecords -> merge(ruleRecords, powerRecords(player, limit), limit))
            .doOnNext(records -> log.info("[Orchestrator] Recommendations merged. returned={} limit={}",
                                          records.size(), limit));
    }

    static List<RecommendationRecord> merge(List<RecommendationRecord> ruleRecords,
                                            List<RecommendationRecord> powerRecords, int limit) {
        List<RecommendationRecord> all = new ArrayList<>(ruleRecords);
        all.addAll(powerRecords);
        all.sort(Comparator.comparingInt(RecommendationRecord::priority));

        Set<String> seenActions = new HashSet<>();
        return all.stream()
            .filter(r -> seenActions.add(r.normalizedAction()))
            .limit(Math.max(0, limit))
            .collect(Collectors.toList());
    }

    private List<RecommendationRecord> powerRecords(PlayerSnapshot snapshot, int limit) {
        return powerOptimizer.getTopRecommendations(snapshot, limit).stream()
            .map(PowerOptimizer::toRecommendation)
            .collect(Collectors.toList());
    }

    public List<PowerUpgrade> getPowerRecommendations(PlayerSnapshot snapshot, int limit) {
        return powerOptimizer.getTopRecommendations(orEmpty(snapshot), limit);
    }

    // ── single-purpose views ───────────────────────────────────────────────

    /** @throws com.survivaladvisor.common.exception.UnknownVocabularyException for an unknown mode id */
    public LineupResult getLineup(String modeId, PlayerSnapshot snapshot) {
        return lineupBuilder.buildLineup(GameMode.fromName(modeId), orEmpty(snapshot));
    }

    public JoinerAdvice getJoinerAdvice(PlayerSnapshot snapshot, boolean attack) {
        return lineupBuilder.joinerAdvice(orEmpty(snapshot), attack);
    }

    public PhaseInfo getPhaseInfo(PlayerSnapshot snapshot) {
        return progressionTracker.phaseInfo(orEmpty(snapshot));
    }

    public List<HeroInvestment> getHeroInvestments(PlayerSnapshot snapshot, int limit) {
        return heroAnalyzer.investmentPlan(orEmpty(snapshot), limit);
    }

    /** @throws com.survivaladvisor.common.exception.UnknownVocabularyException for an unknown spender tier */
    public List<GearPriorityEntry> getGearPriority(String spenderTier) {
        return gearAdvisor.gearPriorityOrder(SpenderTier.fromName(spenderTier));
    }

    public ClassifiedRequest classify(String question) {
        return RequestClassifier.classify(question);
    }

    // ── ask ────────────────────────────────────────────────────────────────

    public Mono<AdvisorAnswer> ask(PlayerSnapshot snapshot, String question, boolean forceAi,
                                   AiRequestWindow window) {
        PlayerSnapshot player = orEmpty(snapshot);
        AiRequestWindow aiWindow = window != null ? window : AiRequestWindow.unrestricted();
        String requestId = TraceContextUtil.newRequestId();
        adviceFlowLogger.logWithRequestId(AdviceFlowLogger.ASK_RECEIVED, requestId);

        Mono<AdvisorAnswer> flow = Mono.defer(() -> {
            ClassifiedRequest classified = RequestClassifier.classify(question);
            adviceFlowLogger.logClassification(classified, requestId);

            if (!forceAi && classified.routesToRules()) {
                return answerWithRules(player, question, classified)
                    .doOnEach(adviceFlowLogger.stage(AdviceFlowLogger.RULES_ANSWERED))
                    .flatMap(answer -> enhanceIfNeeded(answer, player, question, classified, aiWindow, requestId));
            }
            return answerWithAi(player, question, classified, aiWindow, requestId);
        });

        return TraceContextUtil.withRequestId(
            flow.onErrorResume(e -> {
                    log.error("[Orchestrator] ask failed, returning static default. requestId={} reason={}",
                              requestId, e.getMessage(), e);
                    return Mono.just(staticDefault());
                })
                .defaultIfEmpty(staticDefault())
                .doOnNext(answer -> adviceFlowLogger.logAnswer(answer, requestId)),
            requestId);
    }

    private Mono<AdvisorAnswer> answerWithAi(PlayerSnapshot snapshot, String question, ClassifiedRequest classified,
                                             AiRequestWindow window, String requestId) {
        if (!aiClient.isAvailable()) {
            adviceFlowLogger.logDegraded("ai_not_configured", requestId);
            return answerWithRules(snapshot, question, classified);
        }
        return aiClient.ask(snapshot, question, classified, window)
            .map(text -> AdvisorAnswer.of(text, AnswerSource.AI, classified.category(),
                                          classified.confidence(), List.of()))
            .doOnEach(adviceFlowLogger.stage(AdviceFlowLogger.AI_ANSWERED))
            .onErrorResume(AiErrorClassifier::isTimeout, e -> {
                adviceFlowLogger.logDegraded("timeout", requestId);
                return answerWithRules(snapshot, question, classified);
            })
            .onErrorResume(e -> {
                AiFailureCategory category = AiErrorClassifier.classify(e);
                log.warn("[Orchestrator] AI call failed. category={} requestId={} reason={}",
                         category, requestId, e.getMessage());
                return Mono.just(AdvisorAnswer.of(category.userMessage(), AnswerSource.ERROR,
                                                  classified.category(), classified.confidence(), List.of()));
            });
    }

    private Mono<AdvisorAnswer> enhanceIfNeeded(AdvisorAnswer answer, PlayerSnapshot snapshot, String question,
                                                ClassifiedRequest classified, AiRequestWindow window,
                                                String requestId) {
        if (classified.intentType() != IntentType.HYBRID
                || !RequestClassifier.needsAiFallback(answer.recommendations(), question)
                || !aiClient.isAvailable()) {
            return Mono.just(answer);
        }
        return aiClient.ask(snapshot, question, classified, window)
            .map(answer::withAiEnhancement)
            .doOnEach(adviceFlowLogger.stage(AdviceFlowLogger.AI_ANSWERED))
            .onErrorResume(e -> {
                adviceFlowLogger.logDegraded("enhancement_" + AiErrorClassifier.classify(e).name().toLowerCase(Locale.ROOT),
                                             requestId);
                return Mono.just(answer);
            })
            .defaultIfEmpty(answer);
    }

    // ── rule answers ───────────────────────────────────────────────────────

    Mono<AdvisorAnswer> answerWithRules(PlayerSnapshot snapshot, String question, ClassifiedRequest classified) {
        RuleHandler handler = classified.ruleHandler();
        if (handler == null) {
            return Mono.just(ruleAnswer(RuleAnswerBuilder.GENERAL, classified, List.of()));
        }
        if (JOINER_HEROES_CATEGORY.equals(classified.category())) {
            return Mono.fromCallable(() -> lineupAnswer(snapshot, question, classified));
        }
        return switch (handler) {
            case LINEUP_BUILDER -> Mono.fromCallable(() -> lineupAnswer(snapshot, question, classified));
            case HERO_ANALYZER -> dispatchService.dispatch(handler, snapshot)
                .map(records -> top(records))
                .map(records -> ruleAnswer(RuleAnswerBuilder.heroUpgrade(records), classified, records));
            case GEAR_ADVISOR -> dispatchService.dispatch(handler, snapshot)
                .map(records -> ruleAnswer(RuleAnswerBuilder.GEAR, classified, top(records)));
            case PROGRESSION_TRACKER -> dispatchService.dispatch(handler, snapshot)
                .map(records -> ruleAnswer(RuleAnswerBuilder.phase(progressionTracker.phaseInfo(snapshot)),
                                           classified, top(records)));
            case COMBINED -> getRecommendations(snapshot, ANSWER_RECORD_LIMIT)
                .map(records -> ruleAnswer(RuleAnswerBuilder.PRIORITY, classified, records));
        };
    }

    private AdvisorAnswer lineupAnswer(PlayerSnapshot snapshot, String question, ClassifiedRequest classified) {
        String lower = question == null ? "" : question.toLowerCase(Locale.ROOT);
        Optional<LineupResult> lineup = lineupBuilder.lineupForQuestion(question, snapshot);

        StringBuilder text = new StringBuilder(lineup.map(RuleAnswerBuilder::lineup)
                                                     .orElse(RuleAnswerBuilder.NO_LINEUP_MATCH));
        if (lower.contains("join") || JOINER_HEROES_CATEGORY.equals(classified.category())) {
            boolean attack = !lower.contains("sergey") && (lower.contains("attack") || !lower.contains("defense"));
            JoinerAdvice advice = lineupBuilder.joinerAdvice(snapshot, attack);
            text.append("\n\n").append(advice.recommendation()).append(' ').append(advice.criticalNote());
        }

        AdvisorAnswer answer = ruleAnswer(text.toString(), classified, List.of());
        return lineup.map(answer::withLineup).orElse(answer);
    }

    private static AdvisorAnswer ruleAnswer(String text, ClassifiedRequest classified,
                                            List<RecommendationRecord> records) {
        return AdvisorAnswer.of(text, AnswerSource.RULES, classified.category(), classified.confidence(), records);
    }

    private static List<RecommendationRecord> top(List<RecommendationRecord> records) {
        return records.stream().limit(ANSWER_RECORD_LIMIT).collect(Collectors.toList());
    }

    private static AdvisorAnswer staticDefault() {
        return AdvisorAnswer.of(RuleAnswerBuilder.STATIC_DEFAULT, AnswerSource.RULES, "general",
                                RequestClassifier.DEFAULT_CONFIDENCE, List.of());
    }

    private static PlayerSnapshot orEmpty(PlayerSnapshot snapshot) {
        return snapshot != null ? snapshot : PlayerSnapshot.empty();
    }
}
