package com.survivaladvisor.common.model;

/**
 * Routing decision for a free-text question.
 *
 * <ul>
 *   <li>{@link #RULES}: answered by a deterministic analyzer</li>
 *   <li>{@link #AI}: needs generative reasoning</li>
 *   <li>{@link #HYBRID}: answered by rules first, optionally enriched by AI</li>
 * </ul>
 */
public enum IntentType {
    RULES,
    AI,
    HYBRID
}
