package com.vidnyan.codequest.domain.level;

/**
 * Ordinal difficulty tiers with their XP rewards.
 */
public enum Difficulty {
    TUTORIAL(1, 50),
    BASIC(2, 100),
    INTERMEDIATE(3, 150),
    ADVANCED(4, 200),
    EXPERT(5, 300);

    private final int value;
    private final int xpReward;

    Difficulty(int value, int xpReward) {
        this.value = value;
        this.xpReward = xpReward;
    }

    public int value() {
        return value;
    }

    public int xpReward() {
        return xpReward;
    }

    public boolean atLeast(Difficulty other) {
        return value >= other.value;
    }

    /**
     * Map a 0-100 difficulty score onto a tier.
     */
    public static Difficulty fromScore(double score) {
        if (score < 20) {
            return TUTORIAL;
        } else if (score < 40) {
            return BASIC;
        } else if (score < 60) {
            return INTERMEDIATE;
        } else if (score < 80) {
            return ADVANCED;
        }
        return EXPERT;
    }
}
