package com.funnelforge.collaborator;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Routes decisions that need a human to an approval queue.
 */
public interface ApprovalGateway {

    /**
     * @return the new request id
     */
    String createRequest(String type, String title, String description,
                         Map<String, Object> context, RiskSummary riskSummary);

    void approve(String requestId, String approver, String comments);

    void reject(String requestId, String approver, String comments);

    List<ApprovalRequest> pending();

    /**
     * @param financial amount of money at stake
     * @param risk      "low", "medium" or "high"
     * @param platforms platforms affected
     * @param outcome   expected outcome if approved
     */
    record RiskSummary(double financial, String risk, List<String> platforms, String outcome) {
        public RiskSummary {
            platforms = platforms == null ? List.of() : List.copyOf(platforms);
        }
    }

    record ApprovalRequest(String id, String type, String title, String description, String priority,
                           Map<String, Object> context, RiskSummary riskSummary, String status,
                           Instant createdAt, Instant reviewedAt, String reviewedBy, String comments) {}
}
