package com.funnelforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Risk-classified outcome of a spend proposal for one arm.
 *
 * @param id               unique identifier (e.g. "spend-0001")
 * @param type             automatic, approval-gated, or blocked
 * @param amount           proposed spend
 * @param armId            arm the spend promotes
 * @param platform         ad platform the spend goes to
 * @param reasoning        human-readable summary of the inputs behind the decision
 * @param approvalRequired true when a human must sign off regardless of type
 * @param riskLevel        computed risk
 * @param expectedRoi      expected revenue divided by the proposed spend
 * @param status           lifecycle status
 * @param createdAt        creation time
 * @param resolvedAt       time of approval, rejection or expiry (nullable)
 * @param resolvedBy       approver or rejecter (nullable)
 */
public record SpendDecision(
    String id,
    DecisionType type,
    double amount,
    String armId,
    String platform,
    String reasoning,
    boolean approvalRequired,
    RiskLevel riskLevel,
    double expectedRoi,
    DecisionStatus status,
    Instant createdAt,
    Instant resolvedAt,
    String resolvedBy
) implements Serializable {

    public SpendDecision resolve(DecisionStatus newStatus, String by, Instant at) {
        return new SpendDecision(id, type, amount, armId, platform, reasoning, approvalRequired,
                riskLevel, expectedRoi, newStatus, createdAt, at, by);
    }

    public SpendDecision withStatus(DecisionStatus newStatus) {
        return new SpendDecision(id, type, amount, armId, platform, reasoning, approvalRequired,
                riskLevel, expectedRoi, newStatus, createdAt, resolvedAt, resolvedBy);
    }
}
