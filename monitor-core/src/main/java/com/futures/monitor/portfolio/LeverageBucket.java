package com.futures.monitor.portfolio;

/**
 * Leverage ranges used for the portfolio-risk breakdown.
 */
public enum LeverageBucket {
    X1("1x", 1, 1),
    X2_TO_5("2-5x", 2, 5),
    X6_TO_10("6-10x", 6, 10),
    X11_TO_20("11-20x", 11, 20),
    X21_TO_50("21-50x", 21, 50),
    X51_PLUS("51x+", 51, Integer.MAX_VALUE);

    private final String label;
    private final int min;
    private final int max;

    LeverageBucket(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() {
        return label;
    }

    public static LeverageBucket of(int leverage) {
        for (LeverageBucket bucket : values()) {
            if (leverage >= bucket.min && leverage <= bucket.max) {
                return bucket;
            }
        }
        // Leverage below 1 is reported by the exchange only for empty rows
        return X1;
    }
}
