package com.funnelforge.core.model;

/**
 * Aggregate view over the orchestrator's current task set.
 *
 * @param tasksCompleted       tasks in COMPLETED
 * @param tasksInProgress      tasks in PROCESSING
 * @param tasksFailed          tasks in FAILED
 * @param tasksAwaitingApproval tasks in REQUIRES_APPROVAL
 * @param totalRevenue         expected revenue of completed tasks
 * @param totalCost            estimated cost of completed tasks
 * @param roas                 totalRevenue / totalCost, 0 without cost
 * @param automationRate       percent of completed tasks that never needed a human
 * @param avgProcessingMinutes mean creation-to-completion time of completed tasks
 * @param errorRate            percent of all tracked tasks that failed
 */
public record TaskMetrics(
    int tasksCompleted,
    int tasksInProgress,
    int tasksFailed,
    int tasksAwaitingApproval,
    double totalRevenue,
    double totalCost,
    double roas,
    double automationRate,
    double avgProcessingMinutes,
    double errorRate
) {}
