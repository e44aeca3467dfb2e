package com.funnelforge.core.model;

/**
 * Lifecycle of a {@link SpendDecision}.
 */
public enum DecisionStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXECUTED,
    EXPIRED  // pending past the approval timeout
}
