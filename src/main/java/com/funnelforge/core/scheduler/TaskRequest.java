package com.funnelforge.core.scheduler;

import com.funnelforge.core.model.TaskPriority;
import com.funnelforge.core.model.TaskType;

import java.util.List;
import java.util.Map;

/**
 * Input to {@link TaskOrchestrator#submit(TaskRequest)}.
 */
public record TaskRequest(
    TaskType type,
    TaskPriority priority,
    String streamKey,
    Map<String, Object> payload,
    List<String> dependencies,
    double estimatedCost,
    double expectedRevenue
) {
    public TaskRequest {
        if (type == null) throw new IllegalArgumentException("type is required");
        priority = priority != null ? priority : TaskPriority.MEDIUM;
        streamKey = streamKey != null ? streamKey : "system";
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static TaskRequest of(TaskType type, TaskPriority priority, String streamKey) {
        return new TaskRequest(type, priority, streamKey, Map.of(), List.of(), 0.0, 0.0);
    }

    public TaskRequest dependingOn(String... taskIds) {
        return new TaskRequest(type, priority, streamKey, payload, List.of(taskIds), estimatedCost, expectedRevenue);
    }
}
