package com.funnelforge.collaborator.simulated;

import com.funnelforge.collaborator.ComplianceChecker.AutoFixResult;
import com.funnelforge.collaborator.ComplianceChecker.ComplianceResult;
import com.funnelforge.collaborator.ComplianceChecker.Content;
import com.funnelforge.collaborator.ComplianceChecker.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordComplianceCheckerTest {

    private final KeywordComplianceChecker checker = new KeywordComplianceChecker();

    private static Content content(String title, String script) {
        return new Content(title, script, "tiktok", "credit");
    }

    @Test
    @DisplayName("disclosed content without claims is compliant")
    void compliant() {
        ComplianceResult result = checker.check(content("Card tips", "Compare fees first #PR"));

        assertTrue(result.isCompliant());
        assertEquals(Severity.NONE, result.severity());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    @DisplayName("banned phrases are high severity, case-insensitive")
    void bannedPhrase() {
        ComplianceResult result = checker.check(content("RISK-FREE returns", "Sure win #PR"));

        assertFalse(result.isCompliant());
        assertEquals(Severity.HIGH, result.severity());
        assertTrue(result.violations().contains("banned phrase: risk-free"));
        assertTrue(result.violations().contains("banned phrase: sure win"));
    }

    @Test
    @DisplayName("risky claim patterns are detected")
    void riskyPattern() {
        ComplianceResult result = checker.check(content("Yield", "50k yen guaranteed monthly #PR"));

        assertEquals(Severity.HIGH, result.severity());
        assertTrue(result.violations().stream().anyMatch(v -> v.startsWith("risky claim")));
    }

    @Test
    @DisplayName("missing disclosure alone is medium severity")
    void missingDisclosure() {
        ComplianceResult result = checker.check(content("Card tips", "Compare fees first"));

        assertEquals(Severity.MEDIUM, result.severity());
        assertEquals(List.of("missing sponsorship disclosure"), result.violations());
    }

    @Test
    @DisplayName("auto-fix strips banned phrases and adds the disclosure")
    void autoFix() {
        AutoFixResult fixed = checker.autoFix(content("Guaranteed picks", "Easy money   with no risk"));

        assertTrue(fixed.isCompliant());
        assertEquals("picks", fixed.content().title());
        assertEquals("with #PR", fixed.content().script());
        assertEquals("tiktok", fixed.content().platform());
    }

    @Test
    @DisplayName("auto-fix cannot repair risky claim patterns")
    void autoFixLimits() {
        AutoFixResult fixed = checker.autoFix(content("Tips", "Anyone can surely do it"));

        assertFalse(fixed.isCompliant());
        assertTrue(fixed.content().script().endsWith("#PR"));
    }
}
