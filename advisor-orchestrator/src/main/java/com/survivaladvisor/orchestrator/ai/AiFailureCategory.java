package com.survivaladvisor.orchestrator.ai;

/**
 * User-facing buckets for AI collaborator failures. The raw error is logged, never shown.
 */
public enum AiFailureCategory {

    CONFIGURATION("AI service configuration issue. Please contact support."),
    CONNECTIVITY("Could not reach AI service. Please try again."),
    RATE_LIMIT("AI request limit reached. Please try again later."),
    UNAVAILABLE("AI service is temporarily unavailable.");

    private final String userMessage;

    AiFailureCategory(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
