package com.funnelforge.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Profit reporting over a look-back period.
 *
 * @param periodHours       look-back period
 * @param summary           totals over the period
 * @param topArms           up to ten most profitable arms
 * @param streamPerformance per-stream totals for arms updated in the period
 * @param profitTrend       profit windows in the period, oldest first
 */
public record ProfitReport(
    int periodHours,
    Summary summary,
    List<ArmSummary> topArms,
    Map<String, StreamSummary> streamPerformance,
    List<TrendPoint> profitTrend
) {
    public record Summary(double totalProfit, double totalSpend, double averageRoi,
                          int profitableArms, int totalArms) {}

    public record ArmSummary(String id, double profit, double roi, double allocation,
                             long clicks, long conversions) {}

    public record StreamSummary(double profit, double spend, double roi, int arms) {}

    public record TrendPoint(Instant timestamp, double profit, double roi) {}
}
