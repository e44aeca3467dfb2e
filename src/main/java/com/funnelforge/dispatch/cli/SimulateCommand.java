package com.funnelforge.dispatch.cli;

import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.bandit.ProfitTracker;
import com.funnelforge.core.model.Arm;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskStatus;
import com.funnelforge.core.scheduler.TaskOrchestrator;
import com.funnelforge.core.spend.SpendGovernor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: funnelforge simulate --cycles N --arms K
 * <p>
 * Runs content cycles against the simulated collaborators, ticking the orchestrator by hand
 * until each cycle drains, then prints metrics, budget and the top arms.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true,
        description = "Run content cycles against simulated collaborators")
@Component
public class SimulateCommand implements Callable<Integer> {

    // Each content task needs four ticks to reach publishing
    private static final int MAX_TICKS_PER_CYCLE = 20;

    @Option(names = "--cycles", description = "Number of content cycles (default: ${DEFAULT-VALUE})")
    int cycles = 3;

    @Option(names = "--arms", description = "Arms selected per cycle (default: ${DEFAULT-VALUE})")
    int arms = 10;

    @Option(names = "--auto-approve", description = "Approve every task that waits for a human")
    boolean autoApprove;

    private final TaskOrchestrator orchestrator;
    private final ArmRegistry armRegistry;
    private final ProfitTracker profitTracker;
    private final SpendGovernor spendGovernor;

    public SimulateCommand(TaskOrchestrator orchestrator, ArmRegistry armRegistry,
                           ProfitTracker profitTracker, SpendGovernor spendGovernor) {
        this.orchestrator = orchestrator;
        this.armRegistry = armRegistry;
        this.profitTracker = profitTracker;
        this.spendGovernor = spendGovernor;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (cycles < 1 || arms < 1) {
            ConsoleOutput.error("--cycles and --arms must be positive");
            return 2;
        }

        for (int cycle = 1; cycle <= cycles; cycle++) {
            List<String> ids = orchestrator.triggerCycle(arms);
            ConsoleOutput.cycle(cycle, ids.size());

            for (int i = 0; i < MAX_TICKS_PER_CYCLE; i++) {
                if (autoApprove) {
                    approveWaiting();
                }
                if (orchestrator.tick() == 0) break;
            }
            profitTracker.addProfitWindow();
            orchestrator.scheduleOptimization().ifPresent(t -> orchestrator.tick());
        }

        ConsoleOutput.metrics(orchestrator.metrics());
        ConsoleOutput.budget(spendGovernor.getBudgetStatus());

        System.out.println("──────────────────────────────────");
        ConsoleOutput.info("Top arms");
        armRegistry.list().stream()
                .sorted(Comparator.comparingDouble(Arm::profit).reversed())
                .limit(5)
                .forEach(ConsoleOutput::arm);
        return 0;
    }

    private void approveWaiting() {
        for (Task task : orchestrator.listTasks()) {
            if (task.status() == TaskStatus.REQUIRES_APPROVAL) {
                orchestrator.approveTask(task.id(), "simulator", "auto-approved by simulate");
            }
        }
    }
}
