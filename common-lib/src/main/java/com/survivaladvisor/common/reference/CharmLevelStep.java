package com.survivaladvisor.common.reference;

/**
 * One of the 16 charm levels. {@code shape} changes at milestone levels.
 */
public record CharmLevelStep(int level, double bonusPercent, String shape) {}
