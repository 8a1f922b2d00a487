package com.survivaladvisor.analysis.scoring;

import com.survivaladvisor.common.reference.HeroTier;

/**
 * Maps state age to the hero generation currently released, and a hero's generation to
 * how relevant it still is.
 *
 * <p>Generation boundaries (days since state creation): 1 [0,40), 2 [40,120), 3 [120,200),
 * 4 [200,280), 5 [280,360), 6 [360,440), 7 [440,520), 8 from 520.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class GenerationTimeline {

    public static final int MAX_GENERATION = 8;

    private static final int[] GENERATION_START_DAYS = {0, 40, 120, 200, 280, 360, 440, 520};

    private static final double S_PLUS_BOOST = 0.15;

    private GenerationTimeline() {}

    public static int currentGeneration(int stateAgeDays) {
        int age = Math.max(0, stateAgeDays);
        for (int gen = MAX_GENERATION; gen > 1; gen--) {
            if (age >= GENERATION_START_DAYS[gen - 1]) {
                return gen;
            }
        }
        return 1;
    }

    /**
     * Relevance decays with the generation gap: 1.0, 0.9, 0.7, 0.5, then 0.3. S+ heroes up
     * to three generations old get a 0.15 boost, capped at 1.0.
     */
    public static double relevance(int heroGeneration, int currentGeneration, HeroTier tier) {
        int gap = currentGeneration - heroGeneration;
        double relevance;
        if (gap <= 0)      relevance = 1.0;
        else if (gap == 1) relevance = 0.9;
        else if (gap == 2) relevance = 0.7;
        else if (gap == 3) relevance = 0.5;
        else               relevance = 0.3;

        if (tier == HeroTier.S_PLUS && gap > 0 && gap <= 3) {
            relevance = Math.min(1.0, relevance + S_PLUS_BOOST);
        }
        return relevance;
    }
}
