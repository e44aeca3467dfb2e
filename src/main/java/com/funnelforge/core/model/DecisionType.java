package com.funnelforge.core.model;

/**
 * How a spend proposal is handled.
 */
public enum DecisionType {
    AUTOMATIC,
    REQUIRES_APPROVAL,
    EMERGENCY_STOP
}
