package com.survivaladvisor.orchestrator.ai;

import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.IntentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a classified question to the Claude model that answers it.
 *
 * <ul>
 *   <li>{@code HYBRID} enhancement of a rule answer, or an unmatched {@code general}
 *       question → cheap/fast model (Haiku).</li>
 *   <li>Every other AI-routed question (comparisons, hypotheticals, strategy, explicit
 *       AI requests) → strong model (Sonnet).</li>
 * </ul>
 *
 * <p>Model names are constants, not configuration.
 */
public final class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    public static final String CHEAP_MODEL  = "claude-haiku-4-5-20251001";
    public static final String STRONG_MODEL = "claude-sonnet-4-6";

    /** Labels for logs and responses, not used in API calls. */
    public static final String CHEAP_LABEL  = "haiku-fast";
    public static final String STRONG_LABEL = "sonnet-deep";

    /** Token budget for a hybrid enhancement; full answers use the configured budget. */
    public static final int ENHANCEMENT_MAX_TOKENS = 300;

    static final String GENERAL_CATEGORY = "general";

    private ModelSelector() { /* utility class */ }

    public static String selectModel(ClassifiedRequest request) {
        String selected = usesCheapModel(request) ? CHEAP_MODEL : STRONG_MODEL;
        log.info("AI_MODEL_SELECTED intent={} category={} model={}",
            request != null ? request.intentType() : null,
            request != null ? request.category() : null,
            selected);
        return selected;
    }

    /** Pure read-only. No logging. */
    public static String resolveLabel(ClassifiedRequest request) {
        return usesCheapModel(request) ? CHEAP_LABEL : STRONG_LABEL;
    }

    public static int maxTokens(ClassifiedRequest request, int configuredMaxTokens) {
        return isEnhancement(request) ? Math.min(ENHANCEMENT_MAX_TOKENS, configuredMaxTokens) : configuredMaxTokens;
    }

    private static boolean usesCheapModel(ClassifiedRequest request) {
        return request == null
            || isEnhancement(request)
            || GENERAL_CATEGORY.equals(request.category());
    }

    private static boolean isEnhancement(ClassifiedRequest request) {
        return request != null && request.intentType() == IntentType.HYBRID;
    }
}
