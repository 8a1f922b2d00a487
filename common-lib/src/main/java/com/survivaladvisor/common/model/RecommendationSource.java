package com.survivaladvisor.common.model;

public enum RecommendationSource {
    RULES,
    AI,
    POWER
}
