package com.funnelforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A single production step in the funnel, scheduled by the orchestrator once all of its
 * dependencies have completed.
 *
 * @param id                unique identifier (e.g. "task-0001")
 * @param type              which handler executes the task
 * @param status            current execution status
 * @param priority          dispatch priority
 * @param streamKey         content stream the task belongs to ("system" for housekeeping)
 * @param payload           handler inputs and accumulated outputs
 * @param dependencies      IDs of tasks that must be COMPLETED first
 * @param estimatedCost     expected spend for this step
 * @param expectedRevenue   revenue the step is expected to drive
 * @param spendDecisionId   linked spend decision, if any
 * @param approvalRequestId linked approval request, if any
 * @param error             failure reason (nullable)
 * @param sequence          creation order, used as a stable tie-break
 * @param createdAt         creation time
 * @param completedAt       time the task reached a terminal state (nullable)
 */
public record Task(
    String id,
    TaskType type,
    TaskStatus status,
    TaskPriority priority,
    String streamKey,
    Map<String, Object> payload,
    List<String> dependencies,
    double estimatedCost,
    double expectedRevenue,
    String spendDecisionId,
    String approvalRequestId,
    String error,
    long sequence,
    Instant createdAt,
    Instant completedAt
) implements Serializable {

    public Task {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /** String payload value, or null when absent. */
    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean isApproved() {
        return Boolean.TRUE.equals(payload.get(PayloadKeys.APPROVED));
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, type, newStatus, priority, streamKey, payload, dependencies,
                estimatedCost, expectedRevenue, spendDecisionId, approvalRequestId, error,
                sequence, createdAt, completedAt);
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, type, status, priority, streamKey, payload, newDependencies,
                estimatedCost, expectedRevenue, spendDecisionId, approvalRequestId, error,
                sequence, createdAt, completedAt);
    }

    /** Attaches spend decision and approval request ids, keeping existing ones when null. */
    public Task linked(String decisionId, String requestId) {
        return new Task(id, type, status, priority, streamKey, payload, dependencies,
                estimatedCost, expectedRevenue,
                decisionId != null ? decisionId : spendDecisionId,
                requestId != null ? requestId : approvalRequestId,
                error, sequence, createdAt, completedAt);
    }

    public Task completed(Map<String, Object> updates, Instant at) {
        return new Task(id, type, TaskStatus.COMPLETED, priority, streamKey, merge(updates), dependencies,
                estimatedCost, expectedRevenue, spendDecisionId, approvalRequestId, null,
                sequence, createdAt, at);
    }

    public Task failed(String reason, Instant at) {
        return new Task(id, type, TaskStatus.FAILED, priority, streamKey, payload, dependencies,
                estimatedCost, expectedRevenue, spendDecisionId, approvalRequestId, reason,
                sequence, createdAt, at);
    }

    public Task awaitingApproval(Map<String, Object> updates, String decisionId, String requestId) {
        return new Task(id, type, TaskStatus.REQUIRES_APPROVAL, priority, streamKey, merge(updates),
                dependencies, estimatedCost, expectedRevenue,
                decisionId != null ? decisionId : spendDecisionId,
                requestId != null ? requestId : approvalRequestId,
                null, sequence, createdAt, null);
    }

    /** Returns the task to PENDING with its approval gate marked as passed. */
    public Task approved(String approver) {
        var updates = new HashMap<String, Object>();
        updates.put(PayloadKeys.APPROVED, Boolean.TRUE);
        updates.put(PayloadKeys.APPROVED_BY, approver);
        return new Task(id, type, TaskStatus.PENDING, priority, streamKey, merge(updates), dependencies,
                estimatedCost, expectedRevenue, spendDecisionId, approvalRequestId, null,
                sequence, createdAt, null);
    }

    private Map<String, Object> merge(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) return payload;
        var merged = new HashMap<>(payload);
        merged.putAll(updates);
        return merged;
    }
}
