package com.funnelforge.core.exception;

import java.util.List;

/**
 * Raised if a task reaches dispatch while a dependency is not COMPLETED. The scheduler
 * never selects such a task, so seeing this means its eligibility check is broken.
 */
public class DependencyUnmetException extends FunnelException {

    private final String taskId;
    private final List<String> unmet;

    public DependencyUnmetException(String taskId, List<String> unmet) {
        super("Task " + taskId + " dispatched with unmet dependencies " + unmet);
        this.taskId = taskId;
        this.unmet = List.copyOf(unmet);
    }

    public String taskId() {
        return taskId;
    }

    public List<String> unmet() {
        return unmet;
    }
}
