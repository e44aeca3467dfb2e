package com.funnelforge.core.model;

/**
 * Kind of production step a {@link Task} performs.
 */
public enum TaskType {
    CONTENT_GENERATION,
    VIDEO_CREATION,
    COMPLIANCE_CHECK,
    PUBLISHING,
    OPTIMIZATION
}
