package com.advisorplatform.common.model;

public enum HopOutcome {
    OK,
    DEGRADED,
    ERROR
}
