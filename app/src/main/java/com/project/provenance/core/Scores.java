package com.project.provenance.core;

/**
 * Authenticity score rules.
 *
 * {@link #MIN_CONFIDENCE} is both the floor for registering a model and the
 * floor an asset's recalculated score must reach for a transfer to go through.
 */
public final class Scores {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;
    public static final int MIN_CONFIDENCE = 70;

    /** Weight of the model's published confidence in a recalculation, in percent. */
    public static final int MODEL_WEIGHT = 60;
    /** Weight of the asset's prior score in a recalculation, in percent. */
    public static final int HISTORY_WEIGHT = 40;

    private Scores() {
    }

    public static boolean isValidScore(int score) {
        return score >= MIN_SCORE && score <= MAX_SCORE;
    }

    public static boolean isValidConfidence(int confidenceLevel) {
        return confidenceLevel >= MIN_CONFIDENCE && confidenceLevel <= MAX_SCORE;
    }

    public static boolean meetsThreshold(int score) {
        return score >= MIN_CONFIDENCE;
    }

    /**
     * Blend model confidence and prior score: {@code floor((60c + 40p) / 100)}.
     * Inputs are in [0, 100] so the result is too.
     */
    public static int recalculate(int modelConfidence, int currentScore) {
        return (modelConfidence * MODEL_WEIGHT + currentScore * HISTORY_WEIGHT) / 100;
    }
}
