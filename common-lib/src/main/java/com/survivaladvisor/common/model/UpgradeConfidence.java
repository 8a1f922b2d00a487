package com.survivaladvisor.common.model;

/**
 * How the figures of a {@link PowerUpgrade} were obtained.
 *
 * <ul>
 *   <li>{@link #EXACT}: every figure read from a reference-table edge</li>
 *   <li>{@link #ESTIMATED}: a parametric formula stood in for missing table data</li>
 *   <li>{@link #QUALITATIVE}: the subsystem is not tracked numerically</li>
 * </ul>
 */
public enum UpgradeConfidence {
    EXACT,
    ESTIMATED,
    QUALITATIVE
}
