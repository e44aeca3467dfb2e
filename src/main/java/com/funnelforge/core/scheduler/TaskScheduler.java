package com.funnelforge.core.scheduler;

import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the next batch of tasks eligible for dispatch.
 *
 * <p>A task is eligible when it is PENDING and every dependency is COMPLETED. Eligible tasks
 * are ordered by priority rank (CRITICAL first), then by creation order, and the batch is
 * capped at the concurrency limit.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private static final Comparator<Task> DISPATCH_ORDER =
            Comparator.comparingInt((Task t) -> t.priority().rank()).thenComparingLong(Task::sequence);

    /**
     * Compute the next batch of tasks to dispatch.
     *
     * @param tasks   all tracked tasks keyed by id
     * @param limit   maximum batch size
     * @return tasks to dispatch, in dispatch order; empty if nothing is eligible
     */
    public List<Task> computeNextBatch(Map<String, Task> tasks, int limit) {
        var eligible = new ArrayList<Task>();
        for (Task task : tasks.values()) {
            if (task.status() != TaskStatus.PENDING) continue;
            if (!unmetDependencies(task, tasks).isEmpty()) {
                log.debug("  {} [{}] deps unsatisfied: {}", task.id(), task.type(), task.dependencies());
                continue;
            }
            eligible.add(task);
        }
        eligible.sort(DISPATCH_ORDER);

        List<Task> batch = eligible.size() > limit ? eligible.subList(0, limit) : eligible;
        if (!batch.isEmpty()) {
            log.info("computeNextBatch: {} eligible, dispatching {} (limit {})",
                    eligible.size(), batch.size(), limit);
        }
        return List.copyOf(batch);
    }

    /**
     * @return ids of the task's dependencies that are not COMPLETED (missing ones included)
     */
    public List<String> unmetDependencies(Task task, Map<String, Task> tasks) {
        var unmet = new ArrayList<String>();
        for (String dep : task.dependencies()) {
            Task dependency = tasks.get(dep);
            if (dependency == null || dependency.status() != TaskStatus.COMPLETED) {
                unmet.add(dep);
            }
        }
        return unmet;
    }

    /**
     * @return the first dependency of the task that has FAILED, or null
     */
    public String failedDependency(Task task, Map<String, Task> tasks) {
        for (String dep : task.dependencies()) {
            Task dependency = tasks.get(dep);
            if (dependency != null && dependency.status() == TaskStatus.FAILED) {
                return dep;
            }
        }
        return null;
    }

    /** Ids of every dependency referenced by a task that is not yet terminal. */
    public Set<String> liveDependencies(Collection<Task> tasks) {
        var ids = new HashSet<String>();
        for (Task task : tasks) {
            if (!task.status().isTerminal()) {
                ids.addAll(task.dependencies());
            }
        }
        return ids;
    }
}
