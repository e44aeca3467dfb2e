package com.funnelforge.dispatch.api;

import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.model.Task;
import com.funnelforge.core.model.TaskMetrics;
import com.funnelforge.core.scheduler.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the production task pipeline.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskOrchestrator orchestrator;
    private final FunnelProperties properties;

    public TaskController(TaskOrchestrator orchestrator, FunnelProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    /**
     * POST /api/v1/tasks/trigger: Queue a content cycle for bandit-selected arms.
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@RequestParam(required = false) Integer count) {
        int arms = count != null ? count : properties.getArmsPerCycle();
        List<String> ids = orchestrator.triggerCycle(arms);
        log.info("Triggered cycle with {} tasks", ids.size());
        return ResponseEntity.accepted().body(Map.of("tasks", ids));
    }

    @GetMapping
    public List<Task> list() {
        return orchestrator.listTasks();
    }

    @GetMapping("/{id}")
    public Task get(@PathVariable String id) {
        return orchestrator.getTask(id);
    }

    @PostMapping("/{id}/approve")
    public Task approve(@PathVariable String id, @RequestBody(required = false) ReviewRequest review) {
        return orchestrator.approveTask(id, SpendController.approver(review),
                review != null ? review.comments() : null);
    }

    @PostMapping("/{id}/reject")
    public Task reject(@PathVariable String id, @RequestBody(required = false) ReviewRequest review) {
        return orchestrator.rejectTask(id, SpendController.approver(review),
                review != null ? review.comments() : null);
    }

    @PostMapping("/{id}/cancel")
    public Task cancel(@PathVariable String id) {
        return orchestrator.cancel(id);
    }

    @GetMapping("/metrics")
    public TaskMetrics metrics() {
        return orchestrator.metrics();
    }

    /**
     * POST /api/v1/tasks/emergency-stop: Body {@code {"reason": "..."}}; reason defaults to "manual".
     */
    @PostMapping("/emergency-stop")
    public Map<String, Object> emergencyStop(@RequestBody(required = false) Map<String, String> body) {
        String reason = body != null && body.get("reason") != null ? body.get("reason") : "manual";
        orchestrator.emergencyStop(reason);
        return Map.of("stopped", true, "reason", reason);
    }

    @PostMapping("/resume")
    public Map<String, Object> resume() {
        orchestrator.resume();
        return Map.of("stopped", false);
    }
}
