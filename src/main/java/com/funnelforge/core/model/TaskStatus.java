package com.funnelforge.core.model;

/**
 * Status of a production task.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    REQUIRES_APPROVAL;  // suspended until a human approves or rejects

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
