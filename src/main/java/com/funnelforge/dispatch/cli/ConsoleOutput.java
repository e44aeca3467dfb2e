package com.funnelforge.dispatch.cli;

import com.funnelforge.core.model.Arm;
import com.funnelforge.core.model.BudgetStatus;
import com.funnelforge.core.model.TaskMetrics;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Funnelforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FUNNELFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FUNNEL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void cycle(int number, int taskCount) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [CYCLE " + number + "]|@ queued " +
                taskCount + " content task" + (taskCount != 1 ? "s" : "")));
    }

    public static void arm(Arm arm) {
        String profit = arm.profit() >= 0
                ? "@|fg(green) " + String.format("%.2f", arm.profit()) + "|@"
                : "@|fg(red) " + String.format("%.2f", arm.profit()) + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + arm.id() + "  profit " + profit +
                String.format("  alloc %.3f  clicks %d", arm.allocation(), arm.clicks())));
    }

    public static void metrics(TaskMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Task Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + m.tasksCompleted() + " completed|@, @|fg(red) " +
                m.tasksFailed() + " failed|@, " + m.tasksAwaitingApproval() + " awaiting approval"));
        System.out.println(String.format("  Revenue %.2f / cost %.2f (ROAS %.2f)",
                m.totalRevenue(), m.totalCost(), m.roas()));
        System.out.println(String.format("  Automation %.0f%%, errors %.0f%%",
                m.automationRate(), m.errorRate()));
    }

    public static void budget(BudgetStatus b) {
        String color = switch (b.riskStatus()) {
            case SAFE -> "fg(green)";
            case CAUTION -> "fg(yellow)";
            case DANGER -> "fg(red)";
        };
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Budget|@ @|" + color + " " + b.riskStatus() + "|@"));
        System.out.println(String.format("  Daily spent %.2f, remaining %.2f, ROAS %.2f",
                b.dailySpent(), b.remainingBudget(), b.roas()));
        for (String recommendation : b.recommendations()) {
            System.out.println("  - " + recommendation);
        }
    }
}
