package com.advisorplatform.common.model;

public enum SegmentPhase {
    THESIS,
    REBUTTAL
}
