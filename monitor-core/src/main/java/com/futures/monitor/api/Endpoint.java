package com.futures.monitor.api;

/**
 * Futures REST endpoints used by the monitor, with their request weight.
 */
public enum Endpoint {
    SERVER_TIME("/fapi/v1/time", 1, false),
    ACCOUNT("/fapi/v2/account", 5, true),
    POSITION_RISK("/fapi/v2/positionRisk", 5, true),
    USER_TRADES("/fapi/v1/userTrades", 5, true),
    INCOME("/fapi/v1/income", 30, true);

    private final String path;
    private final int weight;
    private final boolean signed;

    Endpoint(String path, int weight, boolean signed) {
        this.path = path;
        this.weight = weight;
        this.signed = signed;
    }

    public String path() {
        return path;
    }

    public int weight() {
        return weight;
    }

    public boolean signed() {
        return signed;
    }
}
