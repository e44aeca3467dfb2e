package com.funnelforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One (stream, platform, hook, template) combination whose profitability is being learned.
 *
 * <p>Instances are immutable snapshots; the registry swaps in a new snapshot on every change.
 *
 * @param id            {@code stream_platform_hook_style}
 * @param streamKey     content stream (niche), e.g. "credit"
 * @param platform      publishing platform, e.g. "tiktok"
 * @param hookType      creative hook, e.g. "question"
 * @param templateStyle video template, e.g. "minimal"
 * @param clicks        cumulative clicks
 * @param conversions   cumulative conversions
 * @param revenue       cumulative revenue
 * @param spend         cumulative ad spend
 * @param profit        always {@code revenue - spend}
 * @param allocation    budget weight in [0,1]; weights of all live arms sum to 1
 * @param alpha         Beta successes (profitable updates + prior)
 * @param beta          Beta failures (unprofitable updates + prior)
 * @param lastUpdated   last time statistics changed
 */
public record Arm(
    String id,
    String streamKey,
    String platform,
    String hookType,
    String templateStyle,
    long clicks,
    long conversions,
    double revenue,
    double spend,
    double profit,
    double allocation,
    double alpha,
    double beta,
    Instant lastUpdated
) implements Serializable {

    public static String idOf(String streamKey, String platform, String hookType, String templateStyle) {
        return streamKey + "_" + platform + "_" + hookType + "_" + templateStyle;
    }

    /** A fresh arm with a uniform Beta(1, 1) prior. */
    public static Arm initial(String streamKey, String platform, String hookType, String templateStyle,
                              double allocation, Instant now) {
        return new Arm(idOf(streamKey, platform, hookType, templateStyle),
                streamKey, platform, hookType, templateStyle,
                0, 0, 0.0, 0.0, 0.0, allocation, 1.0, 1.0, now);
    }

    /**
     * Accumulates an observed outcome. Credit goes to alpha when the cumulative profit is
     * positive after the update, otherwise to beta.
     */
    public Arm withOutcome(double revenueDelta, double spendDelta, long clicksDelta,
                           long conversionsDelta, Instant now) {
        double newRevenue = revenue + revenueDelta;
        double newSpend = spend + spendDelta;
        double newProfit = newRevenue - newSpend;
        return new Arm(id, streamKey, platform, hookType, templateStyle,
                clicks + clicksDelta, conversions + conversionsDelta,
                newRevenue, newSpend, newProfit, allocation,
                newProfit > 0 ? alpha + 1 : alpha,
                newProfit > 0 ? beta : beta + 1,
                now);
    }

    /** Books executed spend without treating it as an outcome. */
    public Arm withSpend(double amount, Instant now) {
        double newSpend = spend + amount;
        return new Arm(id, streamKey, platform, hookType, templateStyle,
                clicks, conversions, revenue, newSpend, revenue - newSpend,
                allocation, alpha, beta, now);
    }

    public Arm withAllocation(double newAllocation) {
        return new Arm(id, streamKey, platform, hookType, templateStyle,
                clicks, conversions, revenue, spend, profit,
                newAllocation, alpha, beta, lastUpdated);
    }

    /** Revenue per unit of spend, 0 when nothing was spent. */
    public double roas() {
        return spend > 0 ? revenue / spend : 0.0;
    }

    /** Profit per unit of spend, 0 when nothing was spent. */
    public double roi() {
        return spend > 0 ? profit / spend : 0.0;
    }
}
