package com.funnelforge.core.scheduler;

import com.funnelforge.collaborator.ApprovalGateway;
import com.funnelforge.collaborator.LogSink;
import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.bandit.BanditOptimizer;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.events.EventBus;
import com.funnelforge.core.events.FunnelEvent;
import com.funnelforge.core.exception.ArmNotFoundException;
import com.funnelforge.core.exception.DependencyCycleException;
import com.funnelforge.core.exception.DependencyUnmetException;
import com.funnelforge.core.exception.InvalidStateException;
import com.funnelforge.core.exception.NotFoundException;
import com.funnelforge.core.exception.TaskNotFoundException;
import com.funnelforge.core.handlers.HandlerOutcome;
import com.funnelforge.core.handlers.TaskHandler;
import com.funnelforge.core.logging.MdcContext;
import com.funnelforge.core.metrics.FunnelMetrics;
import com.funnelforge.core.model.Arm;
import com.funnelforge.core.model.DecisionStatus;
import com.funnelforge.core.model.PayloadKeys;
import com.funnelforge.core.model.SpendDecision;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskMetrics;
import com.funnelforge.core.model.TaskPriority;
import com.funnelforge.core.model.TaskStatus;
import com.funnelforge.core.model.TaskType;
import com.funnelforge.core.spend.SpendGovernor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the production task graph and drives it forward one tick at a time.
 *
 * <p>Each {@link #tick()} dispatches up to {@code maxConcurrentTasks} eligible tasks on a
 * bounded worker pool and waits for all of them. A handler failure fails only its own task.
 * Handlers chain follow-up tasks that depend on the task that produced them, so a funnel
 * run moves CONTENT_GENERATION, VIDEO_CREATION, COMPLIANCE_CHECK, PUBLISHING across
 * successive ticks.
 *
 * <p>Graph state is guarded by a single lock; handlers run outside it. Ticks never overlap:
 * a tick that starts while another is in progress returns immediately.
 *
 * <p>The emergency stop fails every PENDING and PROCESSING task, halts dispatch and stops
 * automatic spend until {@link #resume()}.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    static final String SYSTEM_STREAM = "system";

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final TaskScheduler scheduler;
    private final SpendGovernor spendGovernor;
    private final BanditOptimizer banditOptimizer;
    private final ArmRegistry armRegistry;
    private final ApprovalGateway approvalGateway;
    private final LogSink logSink;
    private final EventBus eventBus;
    private final FunnelMetrics metrics;
    private final FunnelProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Instant> awaitingSince = new HashMap<>();
    private final AtomicInteger idCounter = new AtomicInteger(0);
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private volatile boolean stopped;

    private final ExecutorService workers;

    public TaskOrchestrator(List<TaskHandler> handlerBeans, TaskScheduler scheduler, SpendGovernor spendGovernor,
                            BanditOptimizer banditOptimizer, ArmRegistry armRegistry,
                            ApprovalGateway approvalGateway, LogSink logSink, EventBus eventBus,
                            FunnelMetrics metrics, FunnelProperties properties, Clock clock) {
        for (TaskHandler handler : handlerBeans) {
            handlers.put(handler.type(), handler);
        }
        this.scheduler = scheduler;
        this.spendGovernor = spendGovernor;
        this.banditOptimizer = banditOptimizer;
        this.armRegistry = armRegistry;
        this.approvalGateway = approvalGateway;
        this.logSink = logSink;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;

        AtomicInteger threadCount = new AtomicInteger(0);
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentTasks()), r -> {
            Thread t = new Thread(r, "funnel-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Task workers stopped");
    }

    // -- Graph -----------------------------------------------------------------

    /**
     * Adds a PENDING task to the graph.
     *
     * @throws TaskNotFoundException if a dependency id is unknown
     */
    public Task submit(TaskRequest request) {
        synchronized (lock) {
            for (String dep : request.dependencies()) {
                if (!tasks.containsKey(dep)) {
                    throw new TaskNotFoundException(dep);
                }
            }
            String id = String.format("task-%04d", idCounter.incrementAndGet());
            var task = new Task(id, request.type(), TaskStatus.PENDING, request.priority(), request.streamKey(),
                    request.payload(), request.dependencies(), request.estimatedCost(), request.expectedRevenue(),
                    null, null, null, sequence.incrementAndGet(), Instant.now(clock), null);
            tasks.put(id, task);
            log.debug("Submitted {} [{}] deps={}", id, task.type(), task.dependencies());
            eventBus.publish(new FunnelEvent("task.created", id,
                    Map.of("type", task.type().name(), "streamKey", task.streamKey()), task.createdAt()));
            return task;
        }
    }

    /**
     * Makes {@code taskId} wait for {@code dependsOnId}.
     *
     * @throws TaskNotFoundException     if either task is unknown
     * @throws InvalidStateException     if {@code taskId} is no longer PENDING
     * @throws DependencyCycleException  if the edge would close a cycle (self-edges included)
     */
    public Task addDependency(String taskId, String dependsOnId) {
        synchronized (lock) {
            Task task = require(taskId);
            require(dependsOnId);
            if (task.status() != TaskStatus.PENDING) {
                throw new InvalidStateException("Cannot add dependency to " + taskId + " in status " + task.status());
            }
            if (task.dependencies().contains(dependsOnId)) {
                return task;
            }
            List<String> path = pathBetween(dependsOnId, taskId);
            if (path != null) {
                var cycle = new ArrayList<String>();
                cycle.add(taskId);
                cycle.addAll(path);
                throw new DependencyCycleException(cycle);
            }
            var deps = new ArrayList<>(task.dependencies());
            deps.add(dependsOnId);
            Task updated = task.withDependencies(deps);
            tasks.put(taskId, updated);
            return updated;
        }
    }

    // Dependency path from -> ... -> to, or null when to is unreachable
    private List<String> pathBetween(String from, String to) {
        Deque<List<String>> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(List.of(from));
        while (!stack.isEmpty()) {
            List<String> path = stack.pop();
            String current = path.get(path.size() - 1);
            if (current.equals(to)) {
                return path;
            }
            if (!visited.add(current)) continue;
            Task task = tasks.get(current);
            if (task == null) continue;
            for (String dep : task.dependencies()) {
                var next = new ArrayList<>(path);
                next.add(dep);
                stack.push(next);
            }
        }
        return null;
    }

    // -- Tick ------------------------------------------------------------------

    /**
     * Runs one scheduling pass: expire stale approvals, dispatch the next batch and wait for
     * it, fail dependents of failed tasks, then collect old terminal tasks.
     *
     * @return number of tasks dispatched
     */
    public int tick() {
        if (stopped) {
            log.debug("Tick skipped: emergency stop active");
            return 0;
        }
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Tick skipped: previous tick still running");
            return 0;
        }
        try {
            expireApprovals();

            List<Task> batch;
            synchronized (lock) {
                batch = scheduler.computeNextBatch(tasks, properties.getMaxConcurrentTasks());
                for (Task task : batch) {
                    List<String> unmet = scheduler.unmetDependencies(task, tasks);
                    if (!unmet.isEmpty()) {
                        throw new DependencyUnmetException(task.id(), unmet);
                    }
                    tasks.put(task.id(), task.withStatus(TaskStatus.PROCESSING));
                }
            }

            if (!batch.isEmpty()) {
                var futures = new ArrayList<CompletableFuture<Void>>();
                for (Task task : batch) {
                    futures.add(CompletableFuture.runAsync(() -> execute(task), workers));
                }
                for (var future : futures) {
                    try {
                        future.join();
                    } catch (CompletionException e) {
                        log.error("Unexpected error collecting task result", e);
                    }
                }
                metrics.recordBatch(batch.size());
            }

            cascadeFailures();
            garbageCollect();
            return batch.size();
        } finally {
            ticking.set(false);
        }
    }

    private void execute(Task task) {
        MdcContext.setTask(task.id(), task.type().name(), task.streamKey());
        long startMs = System.currentTimeMillis();
        try {
            TaskHandler handler = handlers.get(task.type());
            if (handler == null) {
                throw new IllegalStateException("No handler for task type " + task.type());
            }
            log.info("Processing task {} [{}]", task.id(), task.type());
            eventBus.publish(new FunnelEvent("task.started", task.id(),
                    Map.of("type", task.type().name()), Instant.now(clock)));
            apply(task.id(), handler.handle(task.withStatus(TaskStatus.PROCESSING)));
        } catch (Exception e) {
            log.error("Task {} failed: {}", task.id(), e.getMessage(), e);
            logSink.record("task_error", "Task " + task.id() + " failed: " + e.getMessage(), "error",
                    Map.of("taskId", task.id(), "type", task.type().name()));
            fail(task.id(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), true);
        } finally {
            metrics.recordTaskExecution(task.type().name(), System.currentTimeMillis() - startMs);
            MdcContext.clear();
        }
    }

    private void apply(String taskId, HandlerOutcome outcome) {
        synchronized (lock) {
            Task current = tasks.get(taskId);
            if (current == null || current.status() != TaskStatus.PROCESSING) {
                log.warn("Discarding result for task {}: no longer processing", taskId);
                releaseApproval(taskId, outcome.spendDecisionId(), outcome.approvalRequestId(),
                        "system_discard", "Task " + taskId + " stopped before the result was applied");
                return;
            }
            Instant now = Instant.now(clock);
            Task linked = current.linked(outcome.spendDecisionId(), outcome.approvalRequestId());

            switch (outcome.status()) {
                case COMPLETED -> {
                    Task done = linked.completed(outcome.updates(), now);
                    tasks.put(taskId, done);
                    for (HandlerOutcome.FollowUp followUp : outcome.followUps()) {
                        submit(new TaskRequest(followUp.type(), followUp.priority(), done.streamKey(),
                                followUp.payload(), List.of(taskId), followUp.estimatedCost(),
                                followUp.expectedRevenue()));
                    }
                    publishOutcome(done, "task.completed");
                }
                case REQUIRES_APPROVAL -> {
                    Task waiting = linked.awaitingApproval(outcome.updates(), null, null);
                    tasks.put(taskId, waiting);
                    awaitingSince.put(taskId, now);
                    publishOutcome(waiting, "task.awaiting_approval");
                }
                default -> {
                    Task failed = linked.failed(outcome.failureReason(), now);
                    tasks.put(taskId, failed);
                    publishOutcome(failed, "task.failed");
                }
            }
        }
    }

    private void fail(String taskId, String reason, boolean onlyIfProcessing) {
        synchronized (lock) {
            Task current = tasks.get(taskId);
            if (current == null || current.status().isTerminal()) return;
            if (onlyIfProcessing && current.status() != TaskStatus.PROCESSING) return;
            Task failed = current.failed(reason, Instant.now(clock));
            tasks.put(taskId, failed);
            awaitingSince.remove(taskId);
            publishOutcome(failed, "task.failed");
        }
    }

    private void publishOutcome(Task task, String eventType) {
        metrics.recordTaskOutcome(task.type().name(), task.status().name());
        var payload = new HashMap<String, Object>();
        payload.put("type", task.type().name());
        payload.put("status", task.status().name());
        if (task.error() != null) payload.put("error", task.error());
        eventBus.publish(new FunnelEvent(eventType, task.id(), payload, Instant.now(clock)));
    }

    // Fail-closed: a PENDING task whose dependency failed can never run
    private void cascadeFailures() {
        synchronized (lock) {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Task task : List.copyOf(tasks.values())) {
                    if (task.status() != TaskStatus.PENDING) continue;
                    String failedDep = scheduler.failedDependency(task, tasks);
                    if (failedDep != null) {
                        fail(task.id(), "Dependency " + failedDep + " failed", false);
                        changed = true;
                    }
                }
            }
        }
    }

    private void garbageCollect() {
        Instant cutoff = Instant.now(clock).minus(properties.getRetention());
        synchronized (lock) {
            Set<String> referenced = scheduler.liveDependencies(tasks.values());
            int before = tasks.size();
            tasks.values().removeIf(t -> t.status().isTerminal()
                    && t.completedAt() != null
                    && t.completedAt().isBefore(cutoff)
                    && !referenced.contains(t.id()));
            int removed = before - tasks.size();
            if (removed > 0) {
                log.info("Collected {} terminal tasks older than {}", removed, properties.getRetention());
            }
        }
    }

    private void expireApprovals() {
        Duration timeout = properties.getApprovalTimeout();
        spendGovernor.expireStale(timeout);

        Instant cutoff = Instant.now(clock).minus(timeout);
        List<Task> stale;
        synchronized (lock) {
            stale = tasks.values().stream()
                    .filter(t -> t.status() == TaskStatus.REQUIRES_APPROVAL)
                    .filter(t -> {
                        Instant since = awaitingSince.get(t.id());
                        return since != null && since.isBefore(cutoff);
                    })
                    .toList();
        }
        for (Task task : stale) {
            rejectApprovalRequest(task, "system_timeout", "Approval timed out");
            fail(task.id(), "Approval timed out", false);
            log.info("Task {} approval timed out after {}", task.id(), timeout);
        }
    }

    // -- Funnel cycle ------------------------------------------------------------

    /**
     * Selects arms with the bandit and queues one CONTENT_GENERATION task per arm.
     *
     * @return ids of the created tasks
     * @throws InvalidStateException while the emergency stop is active
     */
    public List<String> triggerCycle(int count) {
        if (stopped) {
            throw new InvalidStateException("Emergency stop active: resume before triggering a cycle");
        }
        List<Arm> arms = banditOptimizer.selectArms(count);
        double uniformShare = armRegistry.size() > 0 ? 1.0 / armRegistry.size() : 0.0;
        double cost = properties.getContentCost();

        var ids = new ArrayList<String>();
        for (Arm arm : arms) {
            double roas = arm.clicks() > 0 && arm.spend() > 0 ? arm.roas() : properties.getPriorRoas();
            TaskPriority priority = arm.allocation() > uniformShare ? TaskPriority.HIGH : TaskPriority.MEDIUM;
            Map<String, Object> payload = Map.of(
                    PayloadKeys.ARM_ID, arm.id(),
                    PayloadKeys.PLATFORM, arm.platform(),
                    PayloadKeys.HOOK_TYPE, arm.hookType(),
                    PayloadKeys.TEMPLATE_STYLE, arm.templateStyle());
            Task task = submit(new TaskRequest(TaskType.CONTENT_GENERATION, priority, arm.streamKey(),
                    payload, List.of(), cost, cost * roas));
            ids.add(task.id());
        }
        logSink.record("cycle_triggered", "Triggered content cycle for " + ids.size() + " arms", "success",
                Map.of("tasks", ids));
        return ids;
    }

    /**
     * Queues the periodic rebalance-and-prune task unless the emergency stop is active.
     */
    public Optional<Task> scheduleOptimization() {
        if (stopped) {
            log.debug("Optimization skipped: emergency stop active");
            return Optional.empty();
        }
        return Optional.of(submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.HIGH, SYSTEM_STREAM)));
    }

    // -- Approvals ---------------------------------------------------------------

    /**
     * Approves a suspended task: the linked spend decision (if still pending) is approved and
     * executed, the approval request is approved, and the task goes back to PENDING with its
     * gate marked passed.
     *
     * <p>When the task's arm was pruned while it waited, the spend is not executed and the
     * task is failed instead.
     *
     * @throws InvalidStateException if the task is not awaiting approval or its spend
     *                               decision was already rejected or expired
     */
    public Task approveTask(String taskId, String approver, String comments) {
        synchronized (lock) {
            Task task = require(taskId);
            if (task.status() != TaskStatus.REQUIRES_APPROVAL) {
                throw new InvalidStateException("Task " + taskId + " is not awaiting approval (" + task.status() + ")");
            }
            if (task.spendDecisionId() != null) {
                SpendDecision decision = spendGovernor.findDecision(task.spendDecisionId()).orElse(null);
                if (decision != null && decision.status() == DecisionStatus.PENDING) {
                    try {
                        spendGovernor.approve(decision.id(), approver);
                    } catch (ArmNotFoundException e) {
                        rejectApprovalRequest(task, "system_arm_missing", e.getMessage());
                        fail(taskId, "Spend not executed: " + e.getMessage(), false);
                        return tasks.get(taskId);
                    }
                } else if (decision != null && decision.status() != DecisionStatus.EXECUTED) {
                    throw new InvalidStateException("Spend decision " + decision.id() + " is " + decision.status());
                }
            }
            if (task.approvalRequestId() != null) {
                try {
                    approvalGateway.approve(task.approvalRequestId(), approver, comments);
                } catch (NotFoundException e) {
                    log.warn("Approval request {} for task {} already resolved", task.approvalRequestId(), taskId);
                }
            }
            Task approved = task.approved(approver);
            tasks.put(taskId, approved);
            awaitingSince.remove(taskId);
            eventBus.publish(new FunnelEvent("task.approved", taskId,
                    Map.of("approver", approver != null ? approver : "unknown"), Instant.now(clock)));
            return approved;
        }
    }

    /**
     * Rejects a suspended task, its pending spend decision and its approval request.
     */
    public Task rejectTask(String taskId, String approver, String comments) {
        synchronized (lock) {
            Task task = require(taskId);
            if (task.status() != TaskStatus.REQUIRES_APPROVAL) {
                throw new InvalidStateException("Task " + taskId + " is not awaiting approval (" + task.status() + ")");
            }
            rejectApprovalRequest(task, approver, comments);
            String reason = "Rejected by " + approver + (comments != null && !comments.isBlank() ? ": " + comments : "");
            fail(taskId, reason, false);
            return tasks.get(taskId);
        }
    }

    /**
     * Cancels a task that has not started or is waiting for approval.
     */
    public Task cancel(String taskId) {
        synchronized (lock) {
            Task task = require(taskId);
            if (task.status() != TaskStatus.PENDING && task.status() != TaskStatus.REQUIRES_APPROVAL) {
                throw new InvalidStateException("Cannot cancel task " + taskId + " in status " + task.status());
            }
            if (task.status() == TaskStatus.REQUIRES_APPROVAL) {
                rejectApprovalRequest(task, "system_cancel", "Cancelled by user");
            }
            fail(taskId, "Cancelled by user", false);
            return tasks.get(taskId);
        }
    }

    private void rejectApprovalRequest(Task task, String by, String comments) {
        releaseApproval(task.id(), task.spendDecisionId(), task.approvalRequestId(), by, comments);
    }

    // Rejects a still-pending spend decision and its gateway request; either id may be null
    private void releaseApproval(String taskId, String decisionId, String requestId, String by, String comments) {
        if (decisionId != null) {
            spendGovernor.findDecision(decisionId)
                    .filter(d -> d.status() == DecisionStatus.PENDING)
                    .ifPresent(d -> spendGovernor.reject(d.id(), by));
        }
        if (requestId != null) {
            try {
                approvalGateway.reject(requestId, by, comments);
            } catch (NotFoundException e) {
                log.warn("Approval request {} for task {} already resolved", requestId, taskId);
            }
        }
    }

    // -- Circuit breaker -----------------------------------------------------------

    /**
     * Halts dispatch, fails every PENDING and PROCESSING task and stops automatic spend.
     */
    public void emergencyStop(String reason) {
        stopped = true;
        int failed = 0;
        synchronized (lock) {
            for (Task task : List.copyOf(tasks.values())) {
                if (task.status() == TaskStatus.PENDING || task.status() == TaskStatus.PROCESSING) {
                    fail(task.id(), "Emergency stop: " + reason, false);
                    failed++;
                }
            }
        }
        spendGovernor.emergencyStop(reason);
        metrics.incrementEmergencyStops("orchestrator");
        log.warn("Emergency stop: {} ({} tasks failed)", reason, failed);
        logSink.record("emergency_stop", "Orchestrator emergency stop: " + reason, "warning",
                Map.of("reason", reason, "failedTasks", failed));
        eventBus.publish(new FunnelEvent("orchestrator.emergency_stop", null,
                Map.of("reason", reason, "failedTasks", failed), Instant.now(clock)));
    }

    /** Clears the stop flag and re-enables automatic spend. Failed tasks stay failed. */
    public void resume() {
        stopped = false;
        spendGovernor.resume();
        log.info("Orchestrator resumed");
        eventBus.publish(new FunnelEvent("orchestrator.resumed", null, Map.of(), Instant.now(clock)));
    }

    public boolean isStopped() {
        return stopped;
    }

    // -- Queries -------------------------------------------------------------------

    public Task getTask(String taskId) {
        synchronized (lock) {
            return require(taskId);
        }
    }

    /** All tracked tasks, newest first. */
    public List<Task> listTasks() {
        synchronized (lock) {
            return tasks.values().stream()
                    .sorted(Comparator.comparingLong(Task::sequence).reversed())
                    .toList();
        }
    }

    public TaskMetrics metrics() {
        List<Task> snapshot;
        synchronized (lock) {
            snapshot = List.copyOf(tasks.values());
        }
        List<Task> completed = snapshot.stream().filter(t -> t.status() == TaskStatus.COMPLETED).toList();
        int inProgress = (int) snapshot.stream().filter(t -> t.status() == TaskStatus.PROCESSING).count();
        int failed = (int) snapshot.stream().filter(t -> t.status() == TaskStatus.FAILED).count();
        int awaiting = (int) snapshot.stream().filter(t -> t.status() == TaskStatus.REQUIRES_APPROVAL).count();

        double revenue = completed.stream().mapToDouble(Task::expectedRevenue).sum();
        double cost = completed.stream().mapToDouble(Task::estimatedCost).sum();
        long automated = completed.stream().filter(t -> !t.isApproved()).count();
        double avgMinutes = completed.stream()
                .filter(t -> t.completedAt() != null)
                .mapToDouble(t -> Duration.between(t.createdAt(), t.completedAt()).toMillis() / 60_000.0)
                .average()
                .orElse(0.0);

        return new TaskMetrics(completed.size(), inProgress, failed, awaiting, revenue, cost,
                cost > 0 ? revenue / cost : 0.0,
                completed.isEmpty() ? 0.0 : automated * 100.0 / completed.size(),
                avgMinutes,
                snapshot.isEmpty() ? 0.0 : failed * 100.0 / snapshot.size());
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }
}
