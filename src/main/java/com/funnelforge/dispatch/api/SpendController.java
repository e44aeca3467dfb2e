package com.funnelforge.dispatch.api;

import com.funnelforge.core.model.BudgetStatus;
import com.funnelforge.core.model.SpendDecision;
import com.funnelforge.core.spend.SpendGovernor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for spend decisions and the daily budget.
 */
@RestController
@RequestMapping("/api/v1/spend")
public class SpendController {

    private final SpendGovernor spendGovernor;

    public SpendController(SpendGovernor spendGovernor) {
        this.spendGovernor = spendGovernor;
    }

    /**
     * POST /api/v1/spend/decisions: Evaluate a spend proposal.
     */
    @PostMapping("/decisions")
    public ResponseEntity<SpendDecision> evaluate(@RequestBody SpendRequest request) {
        if (request.armId() == null || request.armId().isBlank()) {
            throw new IllegalArgumentException("armId is required");
        }
        return ResponseEntity.ok(spendGovernor.evaluate(request.armId(), request.proposedSpend(),
                request.expectedRevenue(), request.platform()));
    }

    @GetMapping("/decisions/pending")
    public List<SpendDecision> pending() {
        return spendGovernor.pendingDecisions();
    }

    @PostMapping("/decisions/{id}/approve")
    public SpendDecision approve(@PathVariable String id, @RequestBody(required = false) ReviewRequest review) {
        return spendGovernor.approve(id, approver(review));
    }

    @PostMapping("/decisions/{id}/reject")
    public SpendDecision reject(@PathVariable String id, @RequestBody(required = false) ReviewRequest review) {
        return spendGovernor.reject(id, approver(review));
    }

    @PostMapping("/decisions/{id}/execute")
    public SpendDecision execute(@PathVariable String id) {
        return spendGovernor.execute(id);
    }

    @GetMapping("/budget")
    public BudgetStatus budget() {
        return spendGovernor.getBudgetStatus();
    }

    static String approver(ReviewRequest review) {
        return review != null ? review.approverOrDefault() : ReviewRequest.DEFAULT_APPROVER;
    }
}
