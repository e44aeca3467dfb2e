package com.funnelforge.core.scheduler;

import com.funnelforge.FunnelFixtures;
import com.funnelforge.FunnelFixtures.MutableClock;
import com.funnelforge.collaborator.ApprovalGateway.RiskSummary;
import com.funnelforge.collaborator.ContentGenerator;
import com.funnelforge.collaborator.ContentGenerator.GeneratedContent;
import com.funnelforge.collaborator.InMemoryApprovalGateway;
import com.funnelforge.collaborator.LogSink;
import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.bandit.BanditOptimizer;
import com.funnelforge.core.bandit.BetaSampler;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.events.EventBus;
import com.funnelforge.core.events.FunnelEvent;
import com.funnelforge.core.exception.DependencyCycleException;
import com.funnelforge.core.exception.InvalidStateException;
import com.funnelforge.core.exception.TaskNotFoundException;
import com.funnelforge.core.handlers.ContentGenerationHandler;
import com.funnelforge.core.handlers.HandlerOutcome;
import com.funnelforge.core.handlers.TaskHandler;
import com.funnelforge.core.metrics.FunnelMetrics;
import com.funnelforge.core.model.*;
import com.funnelforge.core.spend.SpendGovernor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static com.funnelforge.FunnelFixtures.armId;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskOrchestratorTest {

    private static final String ARM = armId("tech", "tiktok", "numeric");

    private FunnelProperties properties;
    private MutableClock clock;
    private EventBus eventBus;
    private ArmRegistry registry;
    private SpendGovernor governor;
    private InMemoryApprovalGateway gateway;
    private ContentGenerator contentGenerator;
    private TaskScheduler scheduler;
    private BanditOptimizer optimizer;
    private FunnelMetrics metrics;
    private LogSink logSink;
    private final List<String> handled = Collections.synchronizedList(new ArrayList<>());

    private TaskOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = FunnelFixtures.properties("tech", "tiktok", "numeric", "question", "limited", "benefit");
        clock = new MutableClock(FunnelFixtures.START);
        eventBus = new EventBus();
        logSink = mock(LogSink.class);
        metrics = new FunnelMetrics(new SimpleMeterRegistry());
        registry = new ArmRegistry(properties, clock, logSink, eventBus, metrics);
        governor = new SpendGovernor(registry, properties, clock, logSink, eventBus, metrics);
        gateway = new InMemoryApprovalGateway(logSink, clock);
        optimizer = new BanditOptimizer(registry, new BetaSampler(new Random(1)), logSink, properties);
        scheduler = new TaskScheduler();
        contentGenerator = mock(ContentGenerator.class);
        when(contentGenerator.generate(anyString(), anyString(), anyString()))
                .thenReturn(new GeneratedContent("5 tricks", "Do this #PR", 80.0));
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private TaskOrchestrator build(TaskHandler... handlers) {
        orchestrator = new TaskOrchestrator(List.of(handlers), scheduler, governor, optimizer, registry,
                gateway, logSink, eventBus, metrics, properties, clock);
        return orchestrator;
    }

    /** Handler whose outcome is computed by a function; records the ids it handled. */
    private StubHandler stub(TaskType type, Function<Task, HandlerOutcome> behaviour) {
        return new StubHandler(type, behaviour, handled);
    }

    private StubHandler completing(TaskType type) {
        return stub(type, t -> HandlerOutcome.completed(Map.of("done", true)));
    }

    private record StubHandler(TaskType type, Function<Task, HandlerOutcome> behaviour, List<String> log)
            implements TaskHandler {
        @Override
        public HandlerOutcome handle(Task task) {
            log.add(task.id());
            return behaviour.apply(task);
        }
    }

    private Task submitContent(double cost, double revenue) {
        return orchestrator.submit(new TaskRequest(TaskType.CONTENT_GENERATION, TaskPriority.MEDIUM, "tech",
                Map.of(PayloadKeys.ARM_ID, ARM, PayloadKeys.PLATFORM, "tiktok", PayloadKeys.HOOK_TYPE, "numeric"),
                List.of(), cost, revenue));
    }

    private ContentGenerationHandler contentHandler() {
        return new ContentGenerationHandler(governor, gateway, contentGenerator, properties);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    // -- Graph -----------------------------------------------------------------

    @Nested
    @DisplayName("task graph")
    class Graph {

        @Test
        @DisplayName("chain A->B->C runs one task per tick in dependency order")
        void chain() {
            build(completing(TaskType.OPTIMIZATION));
            Task a = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.LOW, null));
            Task b = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.CRITICAL, null)
                    .dependingOn(a.id()));
            Task c = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.CRITICAL, null)
                    .dependingOn(b.id()));

            assertEquals(1, orchestrator.tick());
            assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(a.id()).status());
            assertEquals(TaskStatus.PENDING, orchestrator.getTask(c.id()).status());
            assertEquals(1, orchestrator.tick());
            assertEquals(1, orchestrator.tick());
            assertEquals(0, orchestrator.tick());

            assertEquals(List.of(a.id(), b.id(), c.id()), handled);
            assertEquals("system", orchestrator.getTask(a.id()).streamKey());
            assertEquals(Boolean.TRUE, orchestrator.getTask(c.id()).payload().get("done"));
        }

        @Test
        @DisplayName("batch size is bounded by max concurrent tasks")
        void concurrencyLimit() {
            properties.getScheduler().setMaxConcurrentTasks(2);
            build(completing(TaskType.OPTIMIZATION));
            for (int i = 0; i < 5; i++) {
                orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.MEDIUM, null));
            }

            assertEquals(2, orchestrator.tick());
            assertEquals(2, orchestrator.tick());
            assertEquals(1, orchestrator.tick());
        }

        @Test
        @DisplayName("edge closing a cycle is rejected with the cycle path")
        void cycleRejected() {
            build(completing(TaskType.OPTIMIZATION));
            Task a = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            Task b = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null).dependingOn(a.id()));
            Task c = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null).dependingOn(b.id()));

            var ex = assertThrows(DependencyCycleException.class, () -> orchestrator.addDependency(a.id(), c.id()));

            assertEquals(List.of(a.id(), c.id(), b.id(), a.id()), ex.cycle());
            assertTrue(orchestrator.getTask(a.id()).dependencies().isEmpty());
        }

        @Test
        @DisplayName("self-dependency is a cycle")
        void selfDependency() {
            build(completing(TaskType.OPTIMIZATION));
            Task a = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));

            assertThrows(DependencyCycleException.class, () -> orchestrator.addDependency(a.id(), a.id()));
        }

        @Test
        @DisplayName("addDependency delays an otherwise eligible task")
        void addDependency() {
            build(completing(TaskType.OPTIMIZATION));
            Task a = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.LOW, null));
            Task b = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, TaskPriority.LOW, null));

            orchestrator.addDependency(a.id(), b.id());
            orchestrator.tick();

            assertEquals(List.of(b.id()), handled);
            assertEquals(TaskStatus.PENDING, orchestrator.getTask(a.id()).status());
        }

        @Test
        @DisplayName("unknown ids and non-pending tasks are refused")
        void invalidEdges() {
            build(completing(TaskType.OPTIMIZATION));
            Task a = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            Task b = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));

            assertThrows(TaskNotFoundException.class,
                    () -> orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null).dependingOn("task-9999")));
            assertThrows(TaskNotFoundException.class, () -> orchestrator.addDependency(a.id(), "task-9999"));

            orchestrator.tick();
            assertThrows(InvalidStateException.class, () -> orchestrator.addDependency(a.id(), b.id()));
        }

        @Test
        @DisplayName("listTasks returns newest first")
        void listOrder() {
            build(completing(TaskType.OPTIMIZATION));
            Task a = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            Task b = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));

            assertEquals(List.of(b.id(), a.id()), orchestrator.listTasks().stream().map(Task::id).toList());
            assertThrows(TaskNotFoundException.class, () -> orchestrator.getTask("task-9999"));
        }
    }

    // -- Execution ---------------------------------------------------------------

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        @DisplayName("a failing handler fails only its own task and its dependents")
        void failureIsolation() {
            build(stub(TaskType.VIDEO_CREATION, t -> { throw new IllegalStateException("renderer down"); }),
                  completing(TaskType.OPTIMIZATION));
            Task bad = orchestrator.submit(TaskRequest.of(TaskType.VIDEO_CREATION, null, "tech"));
            Task good = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            Task child = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null).dependingOn(bad.id()));
            Task grandChild = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null)
                    .dependingOn(child.id()));

            assertEquals(2, orchestrator.tick());

            assertEquals(TaskStatus.FAILED, orchestrator.getTask(bad.id()).status());
            assertEquals("renderer down", orchestrator.getTask(bad.id()).error());
            assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(good.id()).status());
            assertEquals("Dependency " + bad.id() + " failed", orchestrator.getTask(child.id()).error());
            assertEquals("Dependency " + child.id() + " failed", orchestrator.getTask(grandChild.id()).error());
        }

        @Test
        @DisplayName("a tick started while another is running dispatches nothing")
        void overlappingTickSkipped() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            build(stub(TaskType.OPTIMIZATION, t -> {
                entered.countDown();
                await(release);
                return HandlerOutcome.completed(Map.of());
            }));
            Task first = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            CompletableFuture<Integer> running = CompletableFuture.supplyAsync(orchestrator::tick);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Task second = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            assertEquals(0, orchestrator.tick());
            assertEquals(TaskStatus.PENDING, orchestrator.getTask(second.id()).status());
            assertEquals(List.of(first.id()), List.copyOf(handled));

            release.countDown();
            assertEquals(1, running.get(5, TimeUnit.SECONDS));
            assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(first.id()).status());

            assertEquals(1, orchestrator.tick());
            assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(second.id()).status());
        }

        @Test
        @DisplayName("a task type without handler fails")
        void missingHandler() {
            build(completing(TaskType.OPTIMIZATION));
            Task task = orchestrator.submit(TaskRequest.of(TaskType.PUBLISHING, null, "tech"));

            orchestrator.tick();

            assertEquals(TaskStatus.FAILED, orchestrator.getTask(task.id()).status());
            assertTrue(orchestrator.getTask(task.id()).error().contains("No handler"));
        }

        @Test
        @DisplayName("follow-ups depend on their parent and inherit the stream")
        void followUps() {
            var video = new HandlerOutcome.FollowUp(TaskType.VIDEO_CREATION, TaskPriority.HIGH,
                    Map.of("title", "t"), 0.17, 5.0);
            build(stub(TaskType.CONTENT_GENERATION, t -> HandlerOutcome.completed(Map.of(), video)));
            Task parent = orchestrator.submit(TaskRequest.of(TaskType.CONTENT_GENERATION, null, "tech"));

            orchestrator.tick();

            Task child = orchestrator.listTasks().get(0);
            assertEquals(TaskType.VIDEO_CREATION, child.type());
            assertEquals(List.of(parent.id()), child.dependencies());
            assertEquals("tech", child.streamKey());
            assertEquals(TaskPriority.HIGH, child.priority());
            assertEquals(0.17, child.estimatedCost());
            assertEquals(TaskStatus.PENDING, child.status());
        }

        @Test
        @DisplayName("lifecycle events are published")
        void events() {
            List<String> types = Collections.synchronizedList(new ArrayList<>());
            eventBus.subscribe("task.", e -> types.add(e.eventType()));
            build(completing(TaskType.OPTIMIZATION));
            orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));

            orchestrator.tick();

            assertEquals(List.of("task.created", "task.started", "task.completed"), types);
        }

        @Test
        @DisplayName("old terminal tasks are collected unless still referenced")
        void garbageCollection() {
            properties.getSpend().setApprovalTimeout(Duration.ofHours(48));
            build(completing(TaskType.OPTIMIZATION),
                  stub(TaskType.COMPLIANCE_CHECK, t -> HandlerOutcome.awaitingApproval(Map.of(), null, null)));
            Task referenced = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            Task loose = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            orchestrator.tick();
            Task waiting = orchestrator.submit(TaskRequest.of(TaskType.COMPLIANCE_CHECK, null, "tech")
                    .dependingOn(referenced.id()));
            orchestrator.tick();
            assertEquals(TaskStatus.REQUIRES_APPROVAL, orchestrator.getTask(waiting.id()).status());

            clock.advance(Duration.ofHours(25));
            orchestrator.tick();

            assertThrows(TaskNotFoundException.class, () -> orchestrator.getTask(loose.id()));
            assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(referenced.id()).status());
        }

        @Test
        @DisplayName("metrics summarise the current task set")
        void taskMetrics() {
            build(completing(TaskType.OPTIMIZATION),
                  stub(TaskType.PUBLISHING, t -> HandlerOutcome.blocked("nope", null)));
            orchestrator.submit(new TaskRequest(TaskType.OPTIMIZATION, null, null, null, null, 2.0, 5.0));
            orchestrator.submit(TaskRequest.of(TaskType.PUBLISHING, null, "tech"));

            orchestrator.tick();
            TaskMetrics m = orchestrator.metrics();

            assertEquals(1, m.tasksCompleted());
            assertEquals(1, m.tasksFailed());
            assertEquals(2.5, m.roas(), 1e-9);
            assertEquals(100.0, m.automationRate());
            assertEquals(50.0, m.errorRate());
        }
    }

    // -- Funnel cycle --------------------------------------------------------------

    @Nested
    @DisplayName("funnel cycle")
    class Cycle {

        @Test
        @DisplayName("trigger queues content tasks with prior ROAS revenue")
        void trigger() {
            build(contentHandler());

            List<String> ids = orchestrator.triggerCycle(2);

            assertEquals(2, ids.size());
            for (String id : ids) {
                Task task = orchestrator.getTask(id);
                assertEquals(TaskType.CONTENT_GENERATION, task.type());
                assertEquals(2.0, task.estimatedCost());
                assertEquals(5.0, task.expectedRevenue(), 1e-9);
                assertEquals(TaskPriority.MEDIUM, task.priority());
                assertTrue(registry.contains(task.payloadString(PayloadKeys.ARM_ID)));
                assertEquals("tech", task.streamKey());
            }
        }

        @Test
        @DisplayName("content task runs the automatic spend and chains the video step")
        void automaticSpend() {
            build(contentHandler());
            Task task = submitContent(2.0, 5.0);

            orchestrator.tick();

            Task done = orchestrator.getTask(task.id());
            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals("5 tricks", done.payload().get(PayloadKeys.TITLE));
            assertEquals(DecisionStatus.EXECUTED,
                    governor.findDecision(done.spendDecisionId()).orElseThrow().status());
            assertEquals(2.0, governor.getDailySpend());
            assertEquals(TaskType.VIDEO_CREATION, orchestrator.listTasks().get(0).type());
        }

        @Test
        @DisplayName("blocked spend fails the task")
        void blockedSpend() {
            build(contentHandler());
            Task task = submitContent(60, 66);

            orchestrator.tick();

            Task failed = orchestrator.getTask(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertTrue(failed.error().startsWith("Spend blocked: "));
            SpendDecision decision = governor.findDecision(failed.spendDecisionId()).orElseThrow();
            assertEquals(DecisionStatus.REJECTED, decision.status());
            assertEquals("system_block", decision.resolvedBy());
        }

        @Test
        @DisplayName("optimization is scheduled as a high priority system task")
        void optimization() {
            build(completing(TaskType.OPTIMIZATION));

            Task task = orchestrator.scheduleOptimization().orElseThrow();

            assertEquals(TaskType.OPTIMIZATION, task.type());
            assertEquals(TaskPriority.HIGH, task.priority());
            assertEquals("system", task.streamKey());
        }
    }

    // -- Approvals -----------------------------------------------------------------

    @Nested
    @DisplayName("approvals")
    class Approvals {

        private Task awaiting() {
            build(contentHandler());
            Task task = submitContent(20, 50);
            orchestrator.tick();
            return orchestrator.getTask(task.id());
        }

        @Test
        @DisplayName("spend needing review suspends the task behind an approval request")
        void suspends() {
            Task task = awaiting();

            assertEquals(TaskStatus.REQUIRES_APPROVAL, task.status());
            assertNotNull(task.spendDecisionId());
            assertNotNull(task.approvalRequestId());
            assertEquals(1, gateway.pending().size());
            assertEquals(1, orchestrator.metrics().tasksAwaitingApproval());
            assertEquals(0, orchestrator.tick());
        }

        @Test
        @DisplayName("approval executes the spend and the task completes on the next tick")
        void approve() {
            Task task = awaiting();

            Task approved = orchestrator.approveTask(task.id(), "alice", "go");

            assertEquals(TaskStatus.PENDING, approved.status());
            assertTrue(approved.isApproved());
            assertEquals(DecisionStatus.EXECUTED,
                    governor.findDecision(task.spendDecisionId()).orElseThrow().status());
            assertEquals(20.0, governor.getDailySpend());
            assertTrue(gateway.pending().isEmpty());

            orchestrator.tick();

            assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(task.id()).status());
            assertEquals(20.0, governor.getDailySpend());
            assertEquals(0.0, orchestrator.metrics().automationRate());
        }

        @Test
        @DisplayName("rejection fails the task and the spend decision")
        void reject() {
            Task task = awaiting();

            Task rejected = orchestrator.rejectTask(task.id(), "bob", "too pricey");

            assertEquals(TaskStatus.FAILED, rejected.status());
            assertEquals("Rejected by bob: too pricey", rejected.error());
            assertEquals(DecisionStatus.REJECTED,
                    governor.findDecision(task.spendDecisionId()).orElseThrow().status());
            assertTrue(gateway.pending().isEmpty());
        }

        @Test
        @DisplayName("pending approvals time out")
        void timeout() {
            Task task = awaiting();
            clock.advance(Duration.ofMinutes(61));

            orchestrator.tick();

            Task expired = orchestrator.getTask(task.id());
            assertEquals(TaskStatus.FAILED, expired.status());
            assertEquals("Approval timed out", expired.error());
            assertEquals(DecisionStatus.EXPIRED,
                    governor.findDecision(task.spendDecisionId()).orElseThrow().status());
            assertTrue(gateway.pending().isEmpty());
        }

        @Test
        @DisplayName("cancel rejects the linked decision")
        void cancelAwaiting() {
            Task task = awaiting();

            Task cancelled = orchestrator.cancel(task.id());

            assertEquals("Cancelled by user", cancelled.error());
            SpendDecision decision = governor.findDecision(task.spendDecisionId()).orElseThrow();
            assertEquals(DecisionStatus.REJECTED, decision.status());
            assertEquals("system_cancel", decision.resolvedBy());
            assertThrows(InvalidStateException.class, () -> orchestrator.cancel(task.id()));
        }

        @Test
        @DisplayName("approving after the arm was pruned fails the task without spending")
        void approvePrunedArm() {
            Task task = awaiting();
            registry.update(ARM, 0, 2000, 200, 0);
            assertEquals(List.of(ARM), registry.prune());

            Task failed = orchestrator.approveTask(task.id(), "alice", null);

            assertEquals(TaskStatus.FAILED, failed.status());
            assertTrue(failed.error().startsWith("Spend not executed"));
            assertEquals(0.0, governor.getDailySpend());
            assertEquals(DecisionStatus.REJECTED,
                    governor.findDecision(task.spendDecisionId()).orElseThrow().status());
            assertTrue(gateway.pending().isEmpty());
        }

        @Test
        @DisplayName("approve is refused for tasks not awaiting approval or with a cleared decision")
        void approveRefused() {
            Task task = awaiting();
            Task other = orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            assertThrows(InvalidStateException.class, () -> orchestrator.approveTask(other.id(), "alice", null));

            governor.emergencyStop("audit");

            assertThrows(InvalidStateException.class, () -> orchestrator.approveTask(task.id(), "alice", null));
        }
    }

    // -- Emergency stop --------------------------------------------------------------

    @Nested
    @DisplayName("emergency stop")
    class EmergencyStop {

        @Test
        @DisplayName("fails pending tasks and dispatches nothing until resumed")
        void stopAndResume() {
            build(completing(TaskType.OPTIMIZATION), contentHandler());
            List<FunnelEvent> stops = new ArrayList<>();
            eventBus.subscribe("orchestrator.emergency_stop", stops::add);
            List<Task> tasks = List.of(
                    orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null)),
                    orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null)),
                    orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null)));

            orchestrator.emergencyStop("manual");

            assertTrue(orchestrator.isStopped());
            assertFalse(governor.isAutoSpendEnabled());
            for (Task task : tasks) {
                Task failed = orchestrator.getTask(task.id());
                assertEquals(TaskStatus.FAILED, failed.status());
                assertEquals("Emergency stop: manual", failed.error());
            }
            assertEquals(1, stops.size());

            orchestrator.submit(TaskRequest.of(TaskType.OPTIMIZATION, null, null));
            assertEquals(0, orchestrator.tick());
            assertEquals(0, orchestrator.tick());
            assertTrue(orchestrator.scheduleOptimization().isEmpty());
            assertThrows(InvalidStateException.class, () -> orchestrator.triggerCycle(1));

            orchestrator.resume();

            assertFalse(orchestrator.isStopped());
            assertTrue(governor.isAutoSpendEnabled());
            assertEquals(1, orchestrator.tick());
            assertEquals(TaskStatus.FAILED, orchestrator.getTask(tasks.get(0).id()).status());
        }

        @Test
        @DisplayName("a result arriving after the stop releases the approval it opened")
        void lateResultReleasesApproval() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            build(stub(TaskType.CONTENT_GENERATION, t -> {
                entered.countDown();
                await(release);
                SpendDecision decision = governor.evaluate(ARM, 20, 50, "tiktok");
                String requestId = gateway.createRequest("spend_decision", "Spend 20.00 on tiktok", "review",
                        Map.of("taskId", t.id()), new RiskSummary(20, "medium", List.of("tiktok"), "content"));
                return HandlerOutcome.awaitingApproval(Map.of(), decision.id(), requestId);
            }));
            Task task = submitContent(20, 50);
            CompletableFuture<Integer> running = CompletableFuture.supplyAsync(orchestrator::tick);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            orchestrator.emergencyStop("manual");
            release.countDown();
            running.get(5, TimeUnit.SECONDS);

            Task failed = orchestrator.getTask(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("Emergency stop: manual", failed.error());
            assertTrue(governor.pendingDecisions().isEmpty());
            SpendDecision decision = governor.findDecision("spend-0001").orElseThrow();
            assertEquals(DecisionStatus.REJECTED, decision.status());
            assertEquals("system_discard", decision.resolvedBy());
            assertTrue(gateway.pending().isEmpty());
        }
    }
}
