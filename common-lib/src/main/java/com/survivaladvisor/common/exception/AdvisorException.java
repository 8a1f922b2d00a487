package com.survivaladvisor.common.exception;

public class AdvisorException extends RuntimeException {
    private final String component;

    public AdvisorException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AdvisorException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
