package com.funnelforge.core.handlers;

import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Periodic housekeeping: rebalance allocations, then prune losing arms.
 */
@Component
public class OptimizationHandler implements TaskHandler {

    private final ArmRegistry armRegistry;

    public OptimizationHandler(ArmRegistry armRegistry) {
        this.armRegistry = armRegistry;
    }

    @Override
    public TaskType type() {
        return TaskType.OPTIMIZATION;
    }

    @Override
    public HandlerOutcome handle(Task task) {
        armRegistry.rebalance();
        List<String> pruned = armRegistry.prune();
        return HandlerOutcome.completed(Map.of(
                "prunedArms", pruned,
                "liveArms", armRegistry.size()));
    }
}
