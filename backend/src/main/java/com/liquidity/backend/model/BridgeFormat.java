package com.liquidity.backend.model;

public enum BridgeFormat {
    TILE,
    CHART,
    INDICATOR
}
