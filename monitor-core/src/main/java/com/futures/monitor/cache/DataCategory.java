package com.futures.monitor.cache;

/**
 * Data categories with distinct staleness tolerances.
 */
public enum DataCategory {
    ACCOUNT(Group.ACCOUNT),
    POSITIONS(Group.ACCOUNT),
    TRADES(Group.HISTORY),
    INCOME(Group.HISTORY);

    private final Group group;

    DataCategory(Group group) {
        this.group = group;
    }

    public Group group() {
        return group;
    }

    /**
     * Invalidation groups: live account state vs historical records.
     */
    public enum Group {
        ACCOUNT,
        HISTORY
    }
}
