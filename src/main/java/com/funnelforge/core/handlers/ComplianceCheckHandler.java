package com.funnelforge.core.handlers;

import com.funnelforge.collaborator.ApprovalGateway;
import com.funnelforge.collaborator.ComplianceChecker;
import com.funnelforge.collaborator.ComplianceChecker.AutoFixResult;
import com.funnelforge.collaborator.ComplianceChecker.ComplianceResult;
import com.funnelforge.collaborator.ComplianceChecker.Content;
import com.funnelforge.collaborator.ComplianceChecker.Severity;
import com.funnelforge.core.exception.CollaboratorFailureException;
import com.funnelforge.core.model.PayloadKeys;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskPriority;
import com.funnelforge.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the script against advertising rules before publishing.
 *
 * <p>High-severity findings are auto-fixed first. Content that is still non-compliant is held
 * for a {@code compliance_override} approval; an approved override publishes as is.
 */
@Component
public class ComplianceCheckHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(ComplianceCheckHandler.class);

    private final ComplianceChecker complianceChecker;
    private final ApprovalGateway approvalGateway;

    public ComplianceCheckHandler(ComplianceChecker complianceChecker, ApprovalGateway approvalGateway) {
        this.complianceChecker = complianceChecker;
        this.approvalGateway = approvalGateway;
    }

    @Override
    public TaskType type() {
        return TaskType.COMPLIANCE_CHECK;
    }

    @Override
    public HandlerOutcome handle(Task task) {
        String platform = task.payloadString(PayloadKeys.PLATFORM);
        var content = new Content(task.payloadString(PayloadKeys.TITLE), task.payloadString(PayloadKeys.SCRIPT),
                platform, task.streamKey());

        if (task.isApproved()) {
            log.info("Compliance override approved for task {}", task.id());
            return HandlerOutcome.completed(Map.of(), publishing(task, content));
        }

        ComplianceResult result;
        try {
            result = complianceChecker.check(content);
            if (!result.isCompliant() && result.severity() == Severity.HIGH) {
                AutoFixResult fixed = complianceChecker.autoFix(content);
                if (fixed.isCompliant()) {
                    log.info("Auto-fixed {} violations for task {}", result.violations().size(), task.id());
                    content = fixed.content();
                    result = new ComplianceResult(true, Severity.NONE, List.of());
                }
            }
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("ComplianceChecker", e);
        }

        var updates = new HashMap<String, Object>();
        putIfPresent(updates, PayloadKeys.TITLE, content.title());
        putIfPresent(updates, PayloadKeys.SCRIPT, content.script());
        updates.put(PayloadKeys.COMPLIANCE_SEVERITY, result.severity().name());
        updates.put(PayloadKeys.COMPLIANCE_VIOLATIONS, result.violations());

        if (!result.isCompliant()) {
            String requestId = approvalGateway.createRequest("compliance_override",
                    "Compliance review: " + content.title(),
                    "Violations: " + String.join(", ", result.violations()),
                    Map.of("taskId", task.id(), "severity", result.severity().name()),
                    new ApprovalGateway.RiskSummary(0.0, riskOf(result.severity()),
                            List.of(platform), "Publish content with unresolved findings"));
            return HandlerOutcome.awaitingApproval(updates, null, requestId);
        }
        return HandlerOutcome.completed(updates, publishing(task, content));
    }

    private static HandlerOutcome.FollowUp publishing(Task task, Content content) {
        var payload = new HashMap<String, Object>();
        ContentGenerationHandler.copy(task, payload, PayloadKeys.ARM_ID, PayloadKeys.PLATFORM,
                PayloadKeys.VIDEO_URL, PayloadKeys.THUMBNAIL_URL);
        putIfPresent(payload, PayloadKeys.TITLE, content.title());
        putIfPresent(payload, PayloadKeys.SCRIPT, content.script());
        payload.put(PayloadKeys.PARENT_TASK_ID, task.id());
        TaskPriority priority = task.priority();
        return new HandlerOutcome.FollowUp(TaskType.PUBLISHING, priority, payload, 0.0, task.expectedRevenue());
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String riskOf(Severity severity) {
        return switch (severity) {
            case HIGH -> "high";
            case MEDIUM -> "medium";
            default -> "low";
        };
    }
}
