package com.dungeon.config;

/**
 * Tunables for region generation, passed explicitly through the pipeline.
 *
 * @param hiddenBaseDifficulty   Perception difficulty of a hidden edge at region difficulty 0
 * @param hiddenDifficultyStep   added per point of region difficulty
 * @param hiddenDifficultyJitter exclusive upper bound of the random bonus
 * @param hiddenMinDifficulty    lower clamp for hidden-edge difficulty
 * @param hiddenMaxDifficulty    upper clamp for hidden-edge difficulty
 * @param deadEndFraction        share of eligible degree-1 nodes typed as dead ends
 * @param minFrontiers           minimum number of frontier nodes per region, at least 2
 */
public record GenerationSettings(
        int hiddenBaseDifficulty,
        int hiddenDifficultyStep,
        int hiddenDifficultyJitter,
        int hiddenMinDifficulty,
        int hiddenMaxDifficulty,
        double deadEndFraction,
        int minFrontiers
) {

    public GenerationSettings {
        if (hiddenMinDifficulty > hiddenMaxDifficulty) {
            throw new IllegalArgumentException("Hidden edge difficulty range is empty: "
                    + hiddenMinDifficulty + ".." + hiddenMaxDifficulty);
        }
        if (hiddenDifficultyJitter < 1) {
            throw new IllegalArgumentException("Hidden edge jitter must be positive, got " + hiddenDifficultyJitter);
        }
        if (deadEndFraction < 0.0 || deadEndFraction > 1.0) {
            throw new IllegalArgumentException("Dead end fraction must be between 0 and 1, got " + deadEndFraction);
        }
        if (minFrontiers < 2) {
            throw new IllegalArgumentException("Minimum frontier count must be at least 2, got " + minFrontiers);
        }
    }

    public static GenerationSettings defaults() {
        return new GenerationSettings(10, 5, 10, 10, 30, 0.2, 2);
    }

    public int clampHiddenDifficulty(int difficulty) {
        return Math.max(hiddenMinDifficulty, Math.min(hiddenMaxDifficulty, difficulty));
    }
}
