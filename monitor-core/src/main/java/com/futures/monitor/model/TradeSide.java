package com.futures.monitor.model;

public enum TradeSide {
    BUY,
    SELL
}
