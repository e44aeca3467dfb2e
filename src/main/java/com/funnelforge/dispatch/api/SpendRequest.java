package com.funnelforge.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/spend/decisions.
 */
public record SpendRequest(
    String armId,
    double proposedSpend,
    double expectedRevenue,
    String platform
) {}
