package com.funnelforge.core.handlers;

import com.funnelforge.collaborator.Publisher;
import com.funnelforge.collaborator.Publisher.PublishRequest;
import com.funnelforge.collaborator.Publisher.PublishResult;
import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.exception.CollaboratorFailureException;
import com.funnelforge.core.model.PayloadKeys;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes the content and feeds the expected revenue back into the arm. Spend was already
 * booked when the content spend was executed.
 */
@Component
public class PublishingHandler implements TaskHandler {

    private final Publisher publisher;
    private final ArmRegistry armRegistry;

    public PublishingHandler(Publisher publisher, ArmRegistry armRegistry) {
        this.publisher = publisher;
        this.armRegistry = armRegistry;
    }

    @Override
    public TaskType type() {
        return TaskType.PUBLISHING;
    }

    @Override
    public HandlerOutcome handle(Task task) {
        String armId = task.payloadString(PayloadKeys.ARM_ID);
        PublishResult result;
        try {
            result = publisher.publish(new PublishRequest(
                    task.payloadString(PayloadKeys.TITLE),
                    task.payloadString(PayloadKeys.SCRIPT),
                    task.payloadString(PayloadKeys.VIDEO_URL),
                    task.payloadString(PayloadKeys.THUMBNAIL_URL),
                    armId), task.payloadString(PayloadKeys.PLATFORM));
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Publisher", e);
        }

        armRegistry.update(armId, task.expectedRevenue(), 0, 1, 1);
        return HandlerOutcome.completed(Map.of(PayloadKeys.CONTENT_ID, result.contentId()));
    }
}
