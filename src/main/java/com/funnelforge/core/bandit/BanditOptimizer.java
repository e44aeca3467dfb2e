package com.funnelforge.core.bandit;

import com.funnelforge.collaborator.LogSink;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.model.Arm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Chooses which arms to produce content for next.
 *
 * <p>Selection reserves an exploration quota of {@code ceil(count * explorationRate)} slots for
 * the least-clicked arms, then fills the remaining slots by Thompson Sampling: each arm draws
 * from {@code Beta(alpha, beta)}, arms with negative profit have their draw scaled down, and
 * the highest scores win. The result never contains duplicates.
 */
@Service
public class BanditOptimizer {

    private static final Logger log = LoggerFactory.getLogger(BanditOptimizer.class);

    static final double MIN_EXPLORATION_RATE = 0.05;
    static final double MAX_EXPLORATION_RATE = 0.5;

    private final ArmRegistry registry;
    private final BetaSampler sampler;
    private final LogSink logSink;
    private final double negativeProfitPenalty;
    private volatile double explorationRate;

    public BanditOptimizer(ArmRegistry registry, BetaSampler sampler, LogSink logSink,
                           FunnelProperties properties) {
        this.registry = registry;
        this.sampler = sampler;
        this.logSink = logSink;
        this.negativeProfitPenalty = properties.getNegativeProfitPenalty();
        this.explorationRate = properties.getExplorationRate();
    }

    /**
     * @param count number of arms wanted; when it reaches the registry size every arm is returned
     * @return selected arms, exploration picks first
     */
    public List<Arm> selectArms(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        List<Arm> arms = registry.list();
        int target = Math.min(count, arms.size());
        if (target == 0) {
            return List.of();
        }

        int quota = Math.min(target, (int) Math.ceil(target * explorationRate));

        // List.sort is stable, so equal click counts keep creation order
        var byClicks = new ArrayList<>(arms);
        byClicks.sort(Comparator.comparingLong(Arm::clicks));

        var selected = new LinkedHashSet<Arm>();
        for (int i = 0; i < quota; i++) {
            selected.add(byClicks.get(i));
        }

        for (ScoredArm scored : rank(arms)) {
            if (selected.size() >= target) break;
            selected.add(scored.arm());
        }

        log.debug("Selected {} arms ({} exploration) from {}", selected.size(), quota, arms.size());
        return List.copyOf(selected);
    }

    List<ScoredArm> rank(List<Arm> arms) {
        var scored = new ArrayList<ScoredArm>(arms.size());
        for (Arm arm : arms) {
            double sample = sampler.sample(arm.alpha(), arm.beta());
            double multiplier = arm.profit() >= 0 ? 1.0 : negativeProfitPenalty;
            scored.add(new ScoredArm(arm, sample * multiplier));
        }
        scored.sort(Comparator.comparingDouble(ScoredArm::score).reversed()
                .thenComparing(s -> s.arm().id()));
        return scored;
    }

    public double getExplorationRate() {
        return explorationRate;
    }

    /**
     * Sets the exploration rate, clamped to [0.05, 0.5].
     *
     * @return the rate actually applied
     */
    public double setExplorationRate(double rate) {
        if (Double.isNaN(rate)) {
            throw new IllegalArgumentException("Exploration rate must be a number");
        }
        explorationRate = Math.max(MIN_EXPLORATION_RATE, Math.min(MAX_EXPLORATION_RATE, rate));
        logSink.record("exploration_rate_update",
                String.format("Exploration rate updated to %.0f%%", explorationRate * 100), "success",
                Map.of("explorationRate", explorationRate));
        return explorationRate;
    }

    record ScoredArm(Arm arm, double score) {}
}
