package com.funnelforge.core.model;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of spend against the daily budget.
 */
public record BudgetStatus(
    double totalSpent,
    double dailySpent,
    double remainingBudget,
    Map<String, Double> platformSpend,
    double roas,
    double profit,
    RiskStatus riskStatus,
    boolean autoSpendEnabled,
    int pendingDecisions,
    List<String> recommendations
) {
    public enum RiskStatus { SAFE, CAUTION, DANGER }
}
