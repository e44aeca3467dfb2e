package com.funnelforge.dispatch.api;

import com.funnelforge.collaborator.ApprovalGateway;
import com.funnelforge.collaborator.ApprovalGateway.ApprovalRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

    private final ApprovalGateway approvalGateway;

    public ApprovalController(ApprovalGateway approvalGateway) {
        this.approvalGateway = approvalGateway;
    }

    /** Pending approval requests, most urgent first. */
    @GetMapping
    public List<ApprovalRequest> pending() {
        return approvalGateway.pending();
    }
}
