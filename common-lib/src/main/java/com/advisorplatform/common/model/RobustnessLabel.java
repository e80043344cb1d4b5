package com.advisorplatform.common.model;

public enum RobustnessLabel {
    BATTLE_TESTED,
    VERIFIED,
    CAUTIONARY,
    HIGH_ENTROPY;

    public static RobustnessLabel of(double confidence) {
        if (confidence >= 0.85) return BATTLE_TESTED;
        if (confidence >= 0.70) return VERIFIED;
        if (confidence >= 0.50) return CAUTIONARY;
        return HIGH_ENTROPY;
    }
}
