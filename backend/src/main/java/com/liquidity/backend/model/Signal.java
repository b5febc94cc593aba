package com.liquidity.backend.model;

public enum Signal {
    RISK_ON,
    RISK_OFF,
    WARNING,
    NEUTRAL
}
