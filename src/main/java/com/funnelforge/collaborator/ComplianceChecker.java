package com.funnelforge.collaborator;

import java.util.List;

/**
 * Checks content against advertising and platform rules.
 */
public interface ComplianceChecker {

    ComplianceResult check(Content content);

    /** Attempts to rewrite the content into a compliant form. */
    AutoFixResult autoFix(Content content);

    record Content(String title, String script, String platform, String niche) {}

    enum Severity { NONE, LOW, MEDIUM, HIGH }

    record ComplianceResult(boolean isCompliant, Severity severity, List<String> violations) {
        public ComplianceResult {
            violations = violations == null ? List.of() : List.copyOf(violations);
        }
    }

    record AutoFixResult(boolean isCompliant, Content content) {}
}
