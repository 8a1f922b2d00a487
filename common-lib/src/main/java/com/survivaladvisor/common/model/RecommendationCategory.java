package com.survivaladvisor.common.model;

public enum RecommendationCategory {
    HERO,
    GEAR,
    LINEUP,
    PROGRESSION,
    POWER
}
