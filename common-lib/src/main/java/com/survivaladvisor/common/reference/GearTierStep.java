package com.survivaladvisor.common.reference;

/**
 * One of the 42 chief-gear tiers with its cumulative stat bonus.
 */
public record GearTierStep(int tier, String name, double bonusPercent) {}
