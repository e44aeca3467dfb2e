package com.funnelforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the decision engine.
 */
@Service
public class FunnelMetrics {

    private final MeterRegistry registry;

    public FunnelMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String taskType, long ms) {
        Timer.builder("funnel.task.duration")
                .tag("type", taskType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String taskType, String status) {
        Counter.builder("funnel.tasks.total")
                .tag("type", taskType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSpendDecision(String decisionType, String riskLevel) {
        Counter.builder("funnel.spend.decisions")
                .tag("type", decisionType)
                .tag("risk", riskLevel)
                .register(registry)
                .increment();
    }

    public void recordSpendExecuted(double amount) {
        DistributionSummary.builder("funnel.spend.executed")
                .description("Amount of each executed spend decision")
                .register(registry)
                .record(amount);
    }

    public void recordArmsPruned(int count) {
        Counter.builder("funnel.arms.pruned")
                .register(registry)
                .increment(count);
    }

    /**
     * Records the number of tasks dispatched by one scheduler tick.
     *
     * @param taskCount tasks in the batch
     */
    public void recordBatch(int taskCount) {
        DistributionSummary.builder("funnel.scheduler.batch_size")
                .description("Tasks dispatched per scheduler tick")
                .register(registry)
                .record(taskCount);
    }

    public void incrementEmergencyStops(String source) {
        Counter.builder("funnel.emergency_stops.total")
                .tag("source", source)
                .register(registry)
                .increment();
    }
}
