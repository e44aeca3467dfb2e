package com.funnelforge.core.health;

import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.model.BudgetStatus;
import com.funnelforge.core.scheduler.TaskOrchestrator;
import com.funnelforge.core.spend.SpendGovernor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskOrchestrator orchestrator;
    private final SpendGovernor spendGovernor;
    private final ArmRegistry armRegistry;

    public HealthCheckService(
            @Autowired(required = false) TaskOrchestrator orchestrator,
            @Autowired(required = false) SpendGovernor spendGovernor,
            @Autowired(required = false) ArmRegistry armRegistry) {
        this.orchestrator = orchestrator;
        this.spendGovernor = spendGovernor;
        this.armRegistry = armRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkScheduler());
        results.add(checkSpendGovernor());
        results.add(checkArmRegistry());
        return results;
    }

    /**
     * Rolls component checks up into one status: DOWN if any component is down, otherwise
     * DEGRADED if any is degraded, otherwise UP.
     */
    public static HealthStatus.Status overallStatus(List<HealthStatus> checks) {
        boolean degraded = false;
        for (HealthStatus check : checks) {
            if (check.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            degraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        return degraded ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
    }

    private HealthStatus checkScheduler() {
        if (orchestrator == null) {
            return new HealthStatus("scheduler", HealthStatus.Status.DOWN,
                    "Task orchestrator not available", Map.of());
        }
        if (orchestrator.isStopped()) {
            return new HealthStatus("scheduler", HealthStatus.Status.DEGRADED,
                    "Emergency stop active", Map.of());
        }
        var metrics = orchestrator.metrics();
        return new HealthStatus("scheduler", HealthStatus.Status.UP, "Dispatching tasks",
                Map.of("inProgress", String.valueOf(metrics.tasksInProgress()),
                       "awaitingApproval", String.valueOf(metrics.tasksAwaitingApproval())));
    }

    private HealthStatus checkSpendGovernor() {
        if (spendGovernor == null) {
            return new HealthStatus("spend", HealthStatus.Status.DOWN,
                    "Spend governor not available", Map.of());
        }
        try {
            BudgetStatus budget = spendGovernor.getBudgetStatus();
            var metadata = Map.of(
                    "dailySpent", String.format("%.2f", budget.dailySpent()),
                    "remainingBudget", String.format("%.2f", budget.remainingBudget()),
                    "riskStatus", budget.riskStatus().name());
            if (!budget.autoSpendEnabled()) {
                return new HealthStatus("spend", HealthStatus.Status.DEGRADED,
                        "Automatic spend disabled", metadata);
            }
            if (budget.remainingBudget() <= 0) {
                return new HealthStatus("spend", HealthStatus.Status.DEGRADED,
                        "Daily budget exhausted", metadata);
            }
            return new HealthStatus("spend", HealthStatus.Status.UP, "Within budget", metadata);
        } catch (Exception e) {
            log.warn("Spend health check failed: {}", e.getMessage());
            return new HealthStatus("spend", HealthStatus.Status.DOWN,
                    "Spend error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkArmRegistry() {
        if (armRegistry == null) {
            return new HealthStatus("arms", HealthStatus.Status.DOWN,
                    "Arm registry not available", Map.of());
        }
        int size = armRegistry.size();
        if (size == 0) {
            return new HealthStatus("arms", HealthStatus.Status.DOWN,
                    "No live arms", Map.of("live", "0"));
        }
        return new HealthStatus("arms", HealthStatus.Status.UP,
                size + " live arms", Map.of("live", String.valueOf(size)));
    }
}
