package com.funnelforge.dispatch.api;

/**
 * Inbound JSON body for approve and reject endpoints.
 *
 * @param approver who is deciding; nullable, defaults to "api"
 * @param comments free-text note; nullable
 */
public record ReviewRequest(
    String approver,
    String comments
) {
    static final String DEFAULT_APPROVER = "api";

    public String approverOrDefault() {
        return approver != null && !approver.isBlank() ? approver : DEFAULT_APPROVER;
    }
}
