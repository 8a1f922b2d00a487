package com.survivaladvisor.orchestrator.logger;

import com.survivaladvisor.common.model.AdvisorAnswer;
import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the {@code ask} lifecycle. Logs stages only; never changes the flow.
 *
 * <p>Stages (in order; the AI stages are skipped on pure rule answers):
 * <ol>
 *   <li>{@link #ASK_RECEIVED}</li>
 *   <li>{@link #REQUEST_CLASSIFIED}</li>
 *   <li>{@link #RULES_ANSWERED}</li>
 *   <li>{@link #AI_ANSWERED} or {@link #AI_DEGRADED}</li>
 *   <li>{@link #ANSWER_READY}</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(adviceFlowLogger.stage(AdviceFlowLogger.RULES_ANSWERED))
 * </pre>
 */
@Component
public class AdviceFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AdviceFlowLogger.class);

    public static final String ASK_RECEIVED       = "ASK_RECEIVED";
    public static final String REQUEST_CLASSIFIED = "REQUEST_CLASSIFIED";
    public static final String RULES_ANSWERED     = "RULES_ANSWERED";
    public static final String AI_ANSWERED        = "AI_ANSWERED";
    public static final String AI_DEGRADED        = "AI_DEGRADED";
    public static final String ANSWER_READY       = "ANSWER_READY";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The request id is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String requestId = TraceContextUtil.getRequestId(signal.getContextView());
            TraceContextUtil.withMdc(requestId, () ->
                log.info("[AdviceFlow] stage={} requestId={}", stageName, requestId)
            );
        };
    }

    public void logWithRequestId(String stageName, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[AdviceFlow] stage={} requestId={}", stageName, requestId)
        );
    }

    public void logClassification(ClassifiedRequest request, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[AdviceFlow] stage={} intent={} category={} confidence={} handler={} requestId={}",
                     REQUEST_CLASSIFIED, request.intentType(), request.category(), request.confidence(),
                     request.ruleHandler() != null ? request.ruleHandler().key() : "N/A", requestId)
        );
    }

    public void logDegraded(String reason, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.warn("[AdviceFlow] stage={} reason={} requestId={}", AI_DEGRADED, reason, requestId)
        );
    }

    /** Compact summary of the final answer. */
    public void logAnswer(AdvisorAnswer answer, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[AdviceFlow] stage={} source={} category={} recommendations={} aiEnhanced={} "
                     + "lineup={} requestId={}",
                     ANSWER_READY, answer.source(), answer.category(), answer.recommendations().size(),
                     answer.aiEnhancement() != null,
                     answer.lineup() != null ? answer.lineup().gameMode() : "N/A",
                     requestId)
        );
    }
}
