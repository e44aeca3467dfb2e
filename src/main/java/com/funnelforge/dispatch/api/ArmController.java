package com.funnelforge.dispatch.api;

import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.bandit.BanditOptimizer;
import com.funnelforge.core.bandit.ProfitTracker;
import com.funnelforge.core.model.Arm;
import com.funnelforge.core.model.ProfitReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for arm statistics and bandit selection.
 */
@RestController
@RequestMapping("/api/v1/arms")
public class ArmController {

    private final ArmRegistry armRegistry;
    private final BanditOptimizer banditOptimizer;
    private final ProfitTracker profitTracker;

    public ArmController(ArmRegistry armRegistry, BanditOptimizer banditOptimizer, ProfitTracker profitTracker) {
        this.armRegistry = armRegistry;
        this.banditOptimizer = banditOptimizer;
        this.profitTracker = profitTracker;
    }

    @GetMapping
    public List<Arm> list() {
        return armRegistry.list();
    }

    @GetMapping("/{id}")
    public Arm get(@PathVariable String id) {
        return armRegistry.get(id);
    }

    /**
     * POST /api/v1/arms/{id}/outcome: Record an observed outcome for an arm.
     */
    @PostMapping("/{id}/outcome")
    public Arm recordOutcome(@PathVariable String id, @RequestBody OutcomeRequest request) {
        return armRegistry.update(id, request.revenue(), request.spend(),
                request.clicks() != null ? request.clicks() : 1,
                request.conversions() != null ? request.conversions() : 0);
    }

    @PostMapping("/select")
    public List<Arm> select(@RequestParam(defaultValue = "10") int count) {
        return banditOptimizer.selectArms(count);
    }

    @PostMapping("/rebalance")
    public Map<String, Double> rebalance() {
        return armRegistry.rebalance();
    }

    @PostMapping("/prune")
    public Map<String, Object> prune() {
        List<String> pruned = armRegistry.prune();
        return Map.of("pruned", pruned, "remaining", armRegistry.size());
    }

    @GetMapping("/report")
    public ProfitReport report(@RequestParam(defaultValue = "24") int hours) {
        return profitTracker.profitReport(hours);
    }

    /**
     * PUT /api/v1/arms/exploration-rate: Body {@code {"rate": 0.2}}; the applied rate is clamped.
     */
    @PutMapping("/exploration-rate")
    public ResponseEntity<Map<String, Object>> setExplorationRate(@RequestBody Map<String, Double> body) {
        Double rate = body.get("rate");
        if (rate == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "rate is required"));
        }
        return ResponseEntity.ok(Map.of("explorationRate", banditOptimizer.setExplorationRate(rate)));
    }
}
