package com.funnelforge.core.model;

/**
 * Dispatch priority; lower rank runs first.
 */
public enum TaskPriority {
    CRITICAL(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
