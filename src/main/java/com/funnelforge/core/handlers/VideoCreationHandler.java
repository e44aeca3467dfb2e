package com.funnelforge.core.handlers;

import com.funnelforge.collaborator.VideoRenderer;
import com.funnelforge.collaborator.VideoRenderer.RenderResult;
import com.funnelforge.core.exception.CollaboratorFailureException;
import com.funnelforge.core.model.PayloadKeys;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders the script and chains the compliance check once the video is ready.
 */
@Component
public class VideoCreationHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(VideoCreationHandler.class);

    private final VideoRenderer videoRenderer;

    public VideoCreationHandler(VideoRenderer videoRenderer) {
        this.videoRenderer = videoRenderer;
    }

    @Override
    public TaskType type() {
        return TaskType.VIDEO_CREATION;
    }

    @Override
    public HandlerOutcome handle(Task task) {
        RenderResult result;
        try {
            result = videoRenderer.render(task.payloadString(PayloadKeys.SCRIPT),
                    task.payloadString(PayloadKeys.PLATFORM));
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("VideoRenderer", e);
        }

        var updates = new HashMap<String, Object>();
        updates.put(PayloadKeys.RENDER_STATUS, result.status() != null ? result.status() : "unknown");
        if (result.videoUrl() != null) updates.put(PayloadKeys.VIDEO_URL, result.videoUrl());
        if (result.thumbnailUrl() != null) updates.put(PayloadKeys.THUMBNAIL_URL, result.thumbnailUrl());

        if (!result.isCompleted()) {
            log.warn("Render for task {} ended in status {}; not chaining compliance check",
                    task.id(), result.status());
            return HandlerOutcome.completed(updates);
        }

        var payload = new HashMap<String, Object>();
        ContentGenerationHandler.copy(task, payload, PayloadKeys.ARM_ID, PayloadKeys.PLATFORM,
                PayloadKeys.TITLE, PayloadKeys.SCRIPT);
        payload.putAll(updates);
        payload.put(PayloadKeys.PARENT_TASK_ID, task.id());

        var compliance = new HandlerOutcome.FollowUp(TaskType.COMPLIANCE_CHECK, task.priority(), payload,
                0.0, task.expectedRevenue());
        return HandlerOutcome.completed(updates, compliance);
    }
}
