package com.funnelforge.core.handlers;

import com.funnelforge.core.model.TaskPriority;
import com.funnelforge.core.model.TaskStatus;
import com.funnelforge.core.model.TaskType;

import java.util.List;
import java.util.Map;

/**
 * Result of running a {@link TaskHandler}.
 *
 * @param status            COMPLETED, REQUIRES_APPROVAL or FAILED
 * @param updates           payload entries to merge into the task
 * @param spendDecisionId   spend decision created by the handler (nullable)
 * @param approvalRequestId approval request created by the handler (nullable)
 * @param followUps         tasks to enqueue, each depending on the handled task
 * @param failureReason     reason when the handler refused to proceed (nullable)
 */
public record HandlerOutcome(
    TaskStatus status,
    Map<String, Object> updates,
    String spendDecisionId,
    String approvalRequestId,
    List<FollowUp> followUps,
    String failureReason
) {

    public HandlerOutcome {
        updates = updates == null ? Map.of() : Map.copyOf(updates);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }

    public static HandlerOutcome completed(Map<String, Object> updates, FollowUp... followUps) {
        return new HandlerOutcome(TaskStatus.COMPLETED, updates, null, null, List.of(followUps), null);
    }

    public static HandlerOutcome completed(Map<String, Object> updates, String spendDecisionId, FollowUp... followUps) {
        return new HandlerOutcome(TaskStatus.COMPLETED, updates, spendDecisionId, null, List.of(followUps), null);
    }

    public static HandlerOutcome awaitingApproval(Map<String, Object> updates, String spendDecisionId,
                                                  String approvalRequestId) {
        return new HandlerOutcome(TaskStatus.REQUIRES_APPROVAL, updates, spendDecisionId, approvalRequestId,
                List.of(), null);
    }

    public static HandlerOutcome blocked(String reason, String spendDecisionId) {
        return new HandlerOutcome(TaskStatus.FAILED, Map.of(), spendDecisionId, null, List.of(), reason);
    }

    /**
     * A task to create once the handled task completes.
     */
    public record FollowUp(TaskType type, TaskPriority priority, Map<String, Object> payload,
                           double estimatedCost, double expectedRevenue) {
        public FollowUp {
            payload = payload == null ? Map.of() : Map.copyOf(payload);
        }
    }
}
