package com.advisorplatform.common.model;

/**
 * Directional read a specialist derives from its evidence.
 * Used by the confidence estimator to measure specialist agreement.
 */
public enum Stance {
    BULLISH,
    BEARISH,
    NEUTRAL
}
