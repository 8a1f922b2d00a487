package com.survivaladvisor.common.model;

public enum LineupConfidence {
    HIGH,
    MEDIUM,
    LOW
}
