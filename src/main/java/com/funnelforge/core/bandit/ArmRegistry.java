package com.funnelforge.core.bandit;

import com.funnelforge.collaborator.LogSink;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.events.EventBus;
import com.funnelforge.core.events.FunnelEvent;
import com.funnelforge.core.exception.ArmNotFoundException;
import com.funnelforge.core.metrics.FunnelMetrics;
import com.funnelforge.core.model.Arm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the performance statistics and Beta parameters of every live arm.
 *
 * <p>The arm universe is the full cross product of configured streams, platforms, hooks and
 * template styles, created eagerly at construction. Arms only leave the registry through
 * {@link #prune()}. Allocation weights of live arms sum to 1 after every rebalance.
 *
 * <p>All operations are serialised on the registry monitor; callers get immutable
 * {@link Arm} snapshots.
 */
@Service
public class ArmRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArmRegistry.class);

    private final Map<String, Arm> arms = new LinkedHashMap<>();
    private final FunnelProperties properties;
    private final Clock clock;
    private final LogSink logSink;
    private final EventBus eventBus;
    private final FunnelMetrics metrics;

    public ArmRegistry(FunnelProperties properties, Clock clock, LogSink logSink,
                       EventBus eventBus, FunnelMetrics metrics) {
        this.properties = properties;
        this.clock = clock;
        this.logSink = logSink;
        this.eventBus = eventBus;
        this.metrics = metrics;
        initialize();
    }

    private void initialize() {
        int total = properties.getStreams().size() * properties.getPlatforms().size()
                * properties.getHookTypes().size() * properties.getTemplateStyles().size();
        double allocation = total > 0 ? 1.0 / total : 0.0;
        Instant now = Instant.now(clock);

        for (String stream : properties.getStreams()) {
            for (String platform : properties.getPlatforms()) {
                for (String hook : properties.getHookTypes()) {
                    for (String style : properties.getTemplateStyles()) {
                        Arm arm = Arm.initial(stream, platform, hook, style, allocation, now);
                        arms.put(arm.id(), arm);
                    }
                }
            }
        }
        log.info("Initialized {} arms", arms.size());
    }

    public synchronized Arm get(String armId) {
        Arm arm = arms.get(armId);
        if (arm == null) {
            throw new ArmNotFoundException(armId);
        }
        return arm;
    }

    public synchronized boolean contains(String armId) {
        return arms.containsKey(armId);
    }

    /**
     * Accumulates an observed outcome and credits the arm's Beta parameters by the sign of
     * its cumulative profit.
     *
     * @return the updated snapshot
     * @throws ArmNotFoundException if the arm does not exist
     */
    public synchronized Arm update(String armId, double revenue, double spend, long clicks, long conversions) {
        Arm updated = get(armId).withOutcome(revenue, spend, clicks, conversions, Instant.now(clock));
        arms.put(armId, updated);

        logSink.record("profit_arm_update",
                String.format("Arm %s updated: profit %.2f, ROI %.0f%%", armId, updated.profit(), updated.roi() * 100),
                "success",
                Map.of("armId", armId, "revenue", revenue, "spend", spend,
                       "totalProfit", updated.profit(), "alpha", updated.alpha(), "beta", updated.beta()));
        eventBus.publish(new FunnelEvent("arm.updated", armId,
                Map.of("profit", updated.profit(), "spend", updated.spend()), updated.lastUpdated()));
        return updated;
    }

    /**
     * Books executed spend against the arm without counting it as an outcome.
     */
    public synchronized Arm recordSpend(String armId, double amount) {
        Arm updated = get(armId).withSpend(amount, Instant.now(clock));
        arms.put(armId, updated);
        log.debug("Recorded spend {} on arm {}", amount, armId);
        return updated;
    }

    /** Live arms in creation order. */
    public synchronized List<Arm> list() {
        return List.copyOf(arms.values());
    }

    public synchronized int size() {
        return arms.size();
    }

    /**
     * Recomputes allocation weights from positive profit. Each arm gets an equal slice of a
     * fixed baseline share plus its share of the remaining weight in proportion to its
     * profit; with no positive profit anywhere all weights are equal.
     *
     * @return the new weights by arm id
     */
    public synchronized Map<String, Double> rebalance() {
        if (arms.isEmpty()) {
            return Map.of();
        }
        int n = arms.size();
        double totalPositive = arms.values().stream().mapToDouble(a -> Math.max(a.profit(), 0)).sum();
        double totalBaseline = properties.getBaselineShare();

        var raw = new LinkedHashMap<String, Double>();
        for (Arm arm : arms.values()) {
            double weight = totalPositive == 0
                    ? 1.0 / n
                    : totalBaseline / n + (Math.max(arm.profit(), 0) / totalPositive) * (1 - totalBaseline);
            raw.put(arm.id(), weight);
        }

        double sum = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        var weights = new LinkedHashMap<String, Double>();
        raw.forEach((id, weight) -> {
            double normalized = weight / sum;
            arms.put(id, arms.get(id).withAllocation(normalized));
            weights.put(id, normalized);
        });

        long profitable = arms.values().stream().filter(a -> a.profit() > 0).count();
        String topArm = arms.values().stream()
                .max(Comparator.comparingDouble(Arm::profit))
                .map(Arm::id)
                .orElse("");
        logSink.record("allocation_rebalance",
                "Rebalanced allocations based on profit: " + profitable + " profitable arms", "success",
                Map.of("totalProfit", totalPositive, "profitableArms", profitable, "topArm", topArm));
        eventBus.publish(new FunnelEvent("arm.rebalanced", null,
                Map.of("arms", n, "profitableArms", profitable), Instant.now(clock)));
        return weights;
    }

    /**
     * Removes arms whose profit is below the prune threshold once they have enough clicks to
     * judge, then rebalances if anything was removed.
     *
     * @return ids of the removed arms
     */
    public synchronized List<String> prune() {
        double threshold = properties.getPruneThreshold();
        long minSamples = properties.getPruneMinSamples();
        var pruned = new ArrayList<String>();

        var it = arms.values().iterator();
        while (it.hasNext()) {
            Arm arm = it.next();
            if (arm.profit() < threshold && arm.clicks() >= minSamples) {
                it.remove();
                pruned.add(arm.id());
                logSink.record("arm_pruned",
                        String.format("Pruned negative arm %s: profit %.2f", arm.id(), arm.profit()), "success",
                        Map.of("armId", arm.id(), "profit", arm.profit(), "clicks", arm.clicks(), "roi", arm.roi()));
                eventBus.publish(new FunnelEvent("arm.pruned", arm.id(),
                        Map.of("profit", arm.profit()), Instant.now(clock)));
            }
        }

        if (!pruned.isEmpty()) {
            metrics.recordArmsPruned(pruned.size());
            rebalance();
            log.info("Pruned {} negative-performing arms", pruned.size());
        }
        return pruned;
    }
}
