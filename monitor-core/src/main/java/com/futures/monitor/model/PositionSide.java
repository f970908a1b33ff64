package com.futures.monitor.model;

/**
 * Direction of an open futures position.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /**
     * Resolve the side from the exchange's {@code positionSide} field.
     * In one-way mode the exchange reports {@code BOTH} and the side follows the amount's sign.
     */
    public static PositionSide resolve(String positionSide, double positionAmount) {
        if ("LONG".equalsIgnoreCase(positionSide)) {
            return LONG;
        }
        if ("SHORT".equalsIgnoreCase(positionSide)) {
            return SHORT;
        }
        return positionAmount < 0 ? SHORT : LONG;
    }
}
