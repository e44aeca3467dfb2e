package com.funnelforge.core.handlers;

import com.funnelforge.collaborator.ApprovalGateway;
import com.funnelforge.collaborator.ContentGenerator;
import com.funnelforge.collaborator.ContentGenerator.GeneratedContent;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.exception.CollaboratorFailureException;
import com.funnelforge.core.model.DecisionStatus;
import com.funnelforge.core.model.DecisionType;
import com.funnelforge.core.model.PayloadKeys;
import com.funnelforge.core.model.SpendDecision;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskType;
import com.funnelforge.core.spend.SpendGovernor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Clears the content spend with the {@link SpendGovernor}, then generates a script and
 * chains the video step.
 *
 * <p>Blocked spend fails the task; spend waiting for review suspends it behind an approval
 * request. Once the task comes back approved the spend check is skipped.
 */
@Component
public class ContentGenerationHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerationHandler.class);

    private final SpendGovernor spendGovernor;
    private final ApprovalGateway approvalGateway;
    private final ContentGenerator contentGenerator;
    private final FunnelProperties properties;

    public ContentGenerationHandler(SpendGovernor spendGovernor, ApprovalGateway approvalGateway,
                                    ContentGenerator contentGenerator, FunnelProperties properties) {
        this.spendGovernor = spendGovernor;
        this.approvalGateway = approvalGateway;
        this.contentGenerator = contentGenerator;
        this.properties = properties;
    }

    @Override
    public TaskType type() {
        return TaskType.CONTENT_GENERATION;
    }

    @Override
    public HandlerOutcome handle(Task task) {
        String armId = task.payloadString(PayloadKeys.ARM_ID);
        String platform = task.payloadString(PayloadKeys.PLATFORM);
        String decisionId = task.spendDecisionId();

        if (!task.isApproved()) {
            SpendDecision decision = spendGovernor.evaluate(armId, task.estimatedCost(),
                    task.expectedRevenue(), platform);
            decisionId = decision.id();

            if (decision.type() == DecisionType.EMERGENCY_STOP) {
                if (decision.status() == DecisionStatus.PENDING) {
                    spendGovernor.reject(decision.id(), "system_block");
                }
                return HandlerOutcome.blocked("Spend blocked: " + decision.reasoning(), decision.id());
            }
            if (decision.status() == DecisionStatus.PENDING) {
                String requestId = approvalGateway.createRequest("spend_decision",
                        String.format("Spend approval: %.2f on %s", decision.amount(), platform),
                        decision.reasoning(),
                        Map.of("taskId", task.id(), "decisionId", decision.id(), "armId", armId),
                        new ApprovalGateway.RiskSummary(decision.amount(),
                                decision.riskLevel().name().toLowerCase(Locale.ROOT),
                                List.of(platform), "Content for " + armId));
                log.info("Task {} waiting for spend approval {}", task.id(), requestId);
                return HandlerOutcome.awaitingApproval(Map.of(), decision.id(), requestId);
            }
        }

        GeneratedContent content;
        try {
            content = contentGenerator.generate(task.streamKey(), platform,
                    task.payloadString(PayloadKeys.HOOK_TYPE));
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("ContentGenerator", e);
        }

        var updates = Map.<String, Object>of(
                PayloadKeys.TITLE, content.title(),
                PayloadKeys.SCRIPT, content.script(),
                PayloadKeys.ESTIMATED_ENGAGEMENT, content.estimatedEngagement());

        var videoPayload = new HashMap<String, Object>();
        copy(task, videoPayload, PayloadKeys.ARM_ID, PayloadKeys.PLATFORM, PayloadKeys.HOOK_TYPE,
                PayloadKeys.TEMPLATE_STYLE);
        videoPayload.put(PayloadKeys.PARENT_TASK_ID, task.id());
        videoPayload.put(PayloadKeys.TITLE, content.title());
        videoPayload.put(PayloadKeys.SCRIPT, content.script());

        var video = new HandlerOutcome.FollowUp(TaskType.VIDEO_CREATION, task.priority(), videoPayload,
                properties.getVideoCost(), task.expectedRevenue());
        return HandlerOutcome.completed(updates, decisionId, video);
    }

    static void copy(Task from, Map<String, Object> to, String... keys) {
        for (String key : keys) {
            Object value = from.payload().get(key);
            if (value != null) {
                to.put(key, value);
            }
        }
    }
}
