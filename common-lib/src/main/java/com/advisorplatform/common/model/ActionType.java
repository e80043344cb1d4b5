package com.advisorplatform.common.model;

public enum ActionType {
    BUY,
    SELL,
    REBALANCE
}
