package com.funnelforge.core.handlers;

import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskType;

/**
 * Executes one type of production task.
 *
 * <p>Handlers never mutate orchestrator state; they return a {@link HandlerOutcome} that the
 * orchestrator applies. A thrown exception fails the task.
 */
public interface TaskHandler {

    TaskType type();

    HandlerOutcome handle(Task task);
}
