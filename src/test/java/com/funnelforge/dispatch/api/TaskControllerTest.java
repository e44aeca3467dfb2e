package com.funnelforge.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelforge.FunnelFixtures;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.exception.InvalidStateException;
import com.funnelforge.core.exception.TaskNotFoundException;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskMetrics;
import com.funnelforge.core.model.TaskPriority;
import com.funnelforge.core.model.TaskStatus;
import com.funnelforge.core.model.TaskType;
import com.funnelforge.core.scheduler.TaskOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private TaskOrchestrator orchestrator;

    @MockitoBean
    private FunnelProperties properties;

    private static Task task(String id, TaskStatus status) {
        return new Task(id, TaskType.PUBLISHING, status, TaskPriority.HIGH, "credit",
                Map.of("platform", "tiktok"), List.of(), 60, 66, "spend-0001", "approval-0001",
                null, 1, FunnelFixtures.START, null);
    }

    // ── POST /api/v1/tasks/trigger ───────────────────────────────────

    @Test
    @DisplayName("POST /trigger uses the configured arms per cycle")
    void triggerDefault() throws Exception {
        when(properties.getArmsPerCycle()).thenReturn(5);
        when(orchestrator.triggerCycle(5)).thenReturn(List.of("task-0001", "task-0002"));

        mockMvc.perform(post("/api/v1/tasks/trigger"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.tasks", hasSize(2)))
                .andExpect(jsonPath("$.tasks[0]").value("task-0001"));
    }

    @Test
    @DisplayName("POST /trigger?count=2 overrides the configured count")
    void triggerWithCount() throws Exception {
        when(orchestrator.triggerCycle(2)).thenReturn(List.of("task-0001"));

        mockMvc.perform(post("/api/v1/tasks/trigger").param("count", "2"))
                .andExpect(status().isAccepted());

        verify(orchestrator).triggerCycle(2);
    }

    @Test
    @DisplayName("POST /trigger during an emergency stop is 409")
    void triggerWhileStopped() throws Exception {
        when(properties.getArmsPerCycle()).thenReturn(5);
        when(orchestrator.triggerCycle(5))
                .thenThrow(new InvalidStateException("Emergency stop active: resume before triggering a cycle"));

        mockMvc.perform(post("/api/v1/tasks/trigger"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Emergency stop active: resume before triggering a cycle"));
    }

    // ── Task lookup ──────────────────────────────────────────────────

    @Test
    @DisplayName("GET /tasks/{id} returns the task")
    void getTask() throws Exception {
        when(orchestrator.getTask("task-0001")).thenReturn(task("task-0001", TaskStatus.REQUIRES_APPROVAL));

        mockMvc.perform(get("/api/v1/tasks/task-0001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REQUIRES_APPROVAL"))
                .andExpect(jsonPath("$.spendDecisionId").value("spend-0001"))
                .andExpect(jsonPath("$.payload.platform").value("tiktok"));
    }

    @Test
    @DisplayName("GET /tasks/{id} returns 404 for unknown task")
    void unknownTask() throws Exception {
        when(orchestrator.getTask("task-9999")).thenThrow(new TaskNotFoundException("task-9999"));

        mockMvc.perform(get("/api/v1/tasks/task-9999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown task: task-9999"));
    }

    // ── Approval ─────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /approve forwards approver and comments")
    void approve() throws Exception {
        when(orchestrator.approveTask("task-0001", "alice", "ship it"))
                .thenReturn(task("task-0001", TaskStatus.PENDING));

        mockMvc.perform(post("/api/v1/tasks/task-0001/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ReviewRequest("alice", "ship it"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("POST /reject without body uses the default approver")
    void rejectDefaultApprover() throws Exception {
        when(orchestrator.rejectTask("task-0001", "api", null)).thenReturn(task("task-0001", TaskStatus.FAILED));

        mockMvc.perform(post("/api/v1/tasks/task-0001/reject"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"));
    }

    @Test
    @DisplayName("POST /approve on a task not awaiting approval is 409")
    void approveWrongState() throws Exception {
        when(orchestrator.approveTask("task-0001", "api", null))
                .thenThrow(new InvalidStateException("Task task-0001 is not awaiting approval"));

        mockMvc.perform(post("/api/v1/tasks/task-0001/approve"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /cancel returns the failed task")
    void cancel() throws Exception {
        when(orchestrator.cancel("task-0001")).thenReturn(task("task-0001", TaskStatus.FAILED));

        mockMvc.perform(post("/api/v1/tasks/task-0001/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"));
    }

    // ── Emergency stop ───────────────────────────────────────────────

    @Test
    @DisplayName("POST /emergency-stop without reason defaults to manual")
    void emergencyStopDefaultReason() throws Exception {
        mockMvc.perform(post("/api/v1/tasks/emergency-stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true))
                .andExpect(jsonPath("$.reason").value("manual"));

        verify(orchestrator).emergencyStop("manual");
    }

    @Test
    @DisplayName("POST /emergency-stop passes the given reason")
    void emergencyStopWithReason() throws Exception {
        mockMvc.perform(post("/api/v1/tasks/emergency-stop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"roas collapse\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reason").value("roas collapse"));

        verify(orchestrator).emergencyStop("roas collapse");
    }

    @Test
    @DisplayName("POST /resume clears the stop")
    void resume() throws Exception {
        mockMvc.perform(post("/api/v1/tasks/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(false));

        verify(orchestrator).resume();
    }

    @Test
    @DisplayName("GET /metrics returns aggregate task metrics")
    void metrics() throws Exception {
        when(orchestrator.metrics()).thenReturn(new TaskMetrics(4, 1, 1, 1, 264, 60, 4.4, 75, 2.5, 14.3));

        mockMvc.perform(get("/api/v1/tasks/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasksCompleted").value(4))
                .andExpect(jsonPath("$.roas").value(4.4))
                .andExpect(jsonPath("$.automationRate").value(75.0));
    }
}
