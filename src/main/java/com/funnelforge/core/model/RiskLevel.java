package com.funnelforge.core.model;

/**
 * Risk classification of a proposed spend.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
