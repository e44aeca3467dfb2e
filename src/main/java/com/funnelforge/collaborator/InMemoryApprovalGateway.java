package com.funnelforge.collaborator;

import com.funnelforge.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Approval queue kept in memory. Requests stay pending until a reviewer resolves them;
 * expiry is driven by the orchestrator, which rejects timed-out requests as
 * {@code system_timeout}.
 */
public class InMemoryApprovalGateway implements ApprovalGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryApprovalGateway.class);
    private static final List<String> PRIORITY_ORDER = List.of("critical", "high", "medium", "low");

    private final AtomicInteger counter = new AtomicInteger(0);
    private final Map<String, ApprovalRequest> pending = new ConcurrentHashMap<>();
    private final LogSink logSink;
    private final Clock clock;

    public InMemoryApprovalGateway(LogSink logSink, Clock clock) {
        this.logSink = logSink;
        this.clock = clock;
    }

    @Override
    public String createRequest(String type, String title, String description,
                                Map<String, Object> context, RiskSummary riskSummary) {
        String id = String.format("approval-%04d", counter.incrementAndGet());
        var request = new ApprovalRequest(id, type, title, description, priorityOf(riskSummary),
                context == null ? Map.of() : Map.copyOf(context), riskSummary, "pending",
                Instant.now(clock), null, null, null);
        pending.put(id, request);

        logSink.record("approval_request", "Human approval required: " + title, "pending",
                Map.of("requestId", id, "type", type == null ? "" : type, "priority", request.priority()));
        log.info("Approval required: {} ({}, priority={})", title, id, request.priority());
        return id;
    }

    @Override
    public void approve(String requestId, String approver, String comments) {
        resolve(requestId, "approved", approver, comments);
    }

    @Override
    public void reject(String requestId, String approver, String comments) {
        resolve(requestId, "rejected", approver, comments);
    }

    @Override
    public List<ApprovalRequest> pending() {
        return pending.values().stream()
                .sorted(Comparator.comparingInt((ApprovalRequest r) -> PRIORITY_ORDER.indexOf(r.priority()))
                        .thenComparing(ApprovalRequest::createdAt))
                .toList();
    }

    private void resolve(String requestId, String status, String reviewer, String comments) {
        ApprovalRequest request = pending.remove(requestId);
        if (request == null) {
            throw new NotFoundException("Unknown approval request: " + requestId);
        }
        logSink.record("approval_decision", "Approval " + status + ": " + request.title(),
                "approved".equals(status) ? "success" : "info",
                Map.of("requestId", requestId, "type", request.type() == null ? "" : request.type(),
                       "reviewedBy", reviewer == null ? "" : reviewer,
                       "comments", comments == null ? "" : comments));
        log.info("Request {} {} by {}", requestId, status, reviewer);
    }

    static String priorityOf(RiskSummary summary) {
        if (summary == null) return "medium";
        if (summary.financial() > 200 || "high".equals(summary.risk())) return "critical";
        if (summary.financial() > 50 || "medium".equals(summary.risk())) return "high";
        if (summary.financial() > 10) return "medium";
        return "low";
    }
}
