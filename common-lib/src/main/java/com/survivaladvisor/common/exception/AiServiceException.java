package com.survivaladvisor.common.exception;

/**
 * Failure at the generative-AI boundary: transport, auth, rate limit or an unusable response.
 * Always recovered inside the orchestrator's {@code ask} flow.
 */
public class AiServiceException extends AdvisorException {

    public AiServiceException(String message) {
        super("AIAdvisor", message);
    }

    public AiServiceException(String message, Throwable cause) {
        super("AIAdvisor", message, cause);
    }
}
