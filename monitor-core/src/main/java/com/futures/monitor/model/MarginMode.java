package com.futures.monitor.model;

public enum MarginMode {
    CROSS,
    ISOLATED;

    public static MarginMode fromWire(String marginType) {
        return "isolated".equalsIgnoreCase(marginType) ? ISOLATED : CROSS;
    }
}
