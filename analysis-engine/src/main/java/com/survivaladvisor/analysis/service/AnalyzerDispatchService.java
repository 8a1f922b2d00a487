package com.survivaladvisor.analysis.service;

import com.survivaladvisor.analysis.analyzer.RuleAnalyzer;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs rule analyzers against one snapshot.
 *
 * <p>Analyzers run one after another in their declared order (hero, gear, lineup,
 * progression), so merged output is deterministic. A failing analyzer is logged and
 * contributes nothing.
 */
@Service
public class AnalyzerDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerDispatchService.class);
    private final List<RuleAnalyzer> analyzers;

    public AnalyzerDispatchService(List<RuleAnalyzer> analyzers) {
        this.analyzers = List.copyOf(analyzers);
    }

    public Mono<List<RecommendationRecord>> dispatchAll(PlayerSnapshot snapshot) {
        log.info("Dispatching {} analyzers in order", analyzers.size());
        return run(analyzers, snapshot);
    }

    /** Output of the analyzer owning {@code handler}; {@link RuleHandler#COMBINED} runs all of them. */
    public Mono<List<RecommendationRecord>> dispatch(RuleHandler handler, PlayerSnapshot snapshot) {
        if (handler == null || handler == RuleHandler.COMBINED) {
            return dispatchAll(snapshot);
        }
        List<RuleAnalyzer> selected = analyzers.stream().filter(a -> a.handler() == handler).toList();
        log.info("Dispatching handler={} analyzers={}", handler.key(), selected.size());
        return run(selected, snapshot);
    }

    private Mono<List<RecommendationRecord>> run(List<RuleAnalyzer> selected, PlayerSnapshot snapshot) {
        return Flux.fromIterable(selected)
            .concatMap(analyzer -> Mono.fromCallable(() -> analyzer.analyze(snapshot))
                .doOnSuccess(records -> log.info("Analyzer={} complete. records={}",
                    analyzer.analyzerName(), records.size()))
                .onErrorResume(e -> {
                    log.error("Analyzer={} failed", analyzer.analyzerName(), e);
                    return Mono.just(List.of());
                })
                .flatMapIterable(records -> records))
            .collectList();
    }

    public List<RuleAnalyzer> analyzers() {
        return analyzers;
    }
}
