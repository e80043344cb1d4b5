package com.advisorplatform.common.model;

/** The two generation tiers the gateway exposes. */
public enum ModelTier {
    /** Fast, cheap, less capable. Default for every segment. */
    SMALL,
    /** Slow, capable. Used when the small model is uncertain. */
    LARGE
}
