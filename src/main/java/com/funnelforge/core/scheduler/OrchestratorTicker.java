package com.funnelforge.core.scheduler;

import com.funnelforge.core.bandit.ProfitTracker;
import com.funnelforge.core.config.FunnelProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock driver for the orchestrator: the dispatch tick, the periodic optimization task
 * and the profit window snapshot. Disabled with {@code funnel.scheduler.enabled=false}, in
 * which case callers drive {@link TaskOrchestrator#tick()} themselves.
 */
@Component
@ConditionalOnProperty(name = "funnel.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class OrchestratorTicker {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorTicker.class);

    private final TaskOrchestrator orchestrator;
    private final ProfitTracker profitTracker;
    private final FunnelProperties properties;

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "funnel-ticker");
        t.setDaemon(true);
        return t;
    });

    public OrchestratorTicker(TaskOrchestrator orchestrator, ProfitTracker profitTracker,
                              FunnelProperties properties) {
        this.orchestrator = orchestrator;
        this.profitTracker = profitTracker;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        long tickMs = properties.getTickInterval().toMillis();
        long optimizationMs = properties.getOptimizationInterval().toMillis();
        long windowMs = properties.getProfitWindowInterval().toMillis();

        timer.scheduleWithFixedDelay(guarded("tick", orchestrator::tick), tickMs, tickMs, TimeUnit.MILLISECONDS);
        timer.scheduleAtFixedRate(guarded("optimization", orchestrator::scheduleOptimization),
                optimizationMs, optimizationMs, TimeUnit.MILLISECONDS);
        timer.scheduleAtFixedRate(guarded("profit-window", profitTracker::addProfitWindow),
                windowMs, windowMs, TimeUnit.MILLISECONDS);
        log.info("Orchestrator ticker started (tick={}, optimization={}, profitWindow={})",
                properties.getTickInterval(), properties.getOptimizationInterval(),
                properties.getProfitWindowInterval());
    }

    @PreDestroy
    void stop() {
        timer.shutdownNow();
        log.info("Orchestrator ticker stopped");
    }

    // A recurring job that throws is never rescheduled, so every job logs and carries on
    private static Runnable guarded(String name, Runnable job) {
        return () -> {
            try {
                job.run();
            } catch (Exception e) {
                log.error("Scheduled {} failed: {}", name, e.getMessage(), e);
            }
        };
    }
}
