package com.survivaladvisor.common.reference;

import java.util.Locale;

/**
 * Community tier ranking of a hero, with the score used by hero valuation.
 */
public enum HeroTier {

    S_PLUS("S+", 1.0),
    S("S", 0.85),
    A("A", 0.7),
    B("B", 0.5),
    C("C", 0.3),
    D("D", 0.15);

    private final String label;
    private final double score;

    HeroTier(String label, double score) {
        this.label = label;
        this.score = score;
    }

    public String label() { return label; }

    public double score() { return score; }

    public boolean isAtLeast(HeroTier other) {
        return ordinal() <= other.ordinal();
    }

    /** Lenient: unknown or blank labels resolve to {@link #C}. */
    public static HeroTier fromLabel(String label) {
        if (label == null) {
            return C;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (HeroTier tier : values()) {
            if (tier.label.equals(normalized)) {
                return tier;
            }
        }
        return C;
    }
}
