package com.funnelforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Rolling profit snapshot appended by the periodic aggregator.
 */
public record ProfitWindow(
    Instant windowStart,
    Instant windowEnd,
    double totalProfit,
    double totalSpend,
    double roi
) implements Serializable {}
