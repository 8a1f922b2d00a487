package com.survivaladvisor.orchestrator.ai;

import com.survivaladvisor.common.classifier.RequestClassifier;
import com.survivaladvisor.common.model.ClassifiedRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelSelectorTest {

    @Test
    @DisplayName("contextual reasoning → strong model")
    void contextual() {
        ClassifiedRequest request = RequestClassifier.classify("ring vs amulet");
        assertEquals(ModelSelector.STRONG_MODEL, ModelSelector.selectModel(request));
        assertEquals(ModelSelector.STRONG_LABEL, ModelSelector.resolveLabel(request));
        assertEquals(500, ModelSelector.maxTokens(request, 500));
    }

    @Test
    @DisplayName("hybrid enhancement → cheap model, capped tokens")
    void hybrid() {
        ClassifiedRequest request = RequestClassifier.classify("what to buy");
        assertEquals(ModelSelector.CHEAP_MODEL, ModelSelector.selectModel(request));
        assertEquals(ModelSelector.ENHANCEMENT_MAX_TOKENS, ModelSelector.maxTokens(request, 500));
        assertEquals(200, ModelSelector.maxTokens(request, 200));
    }

    @Test
    @DisplayName("unmatched question → cheap model")
    void general() {
        assertEquals(ModelSelector.CHEAP_MODEL, ModelSelector.selectModel(RequestClassifier.classify("hello")));
        assertEquals(ModelSelector.CHEAP_LABEL, ModelSelector.resolveLabel(null));
    }
}
