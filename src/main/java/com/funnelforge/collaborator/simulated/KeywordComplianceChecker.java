package com.funnelforge.collaborator.simulated;

import com.funnelforge.collaborator.ComplianceChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rule-based checker for claims that ad platforms reject: guaranteed returns, medical
 * promises, missing sponsorship disclosure.
 */
public class KeywordComplianceChecker implements ComplianceChecker {

    private static final List<String> BANNED_PHRASES = List.of(
            "guaranteed", "100%", "risk-free", "no risk", "get rich", "easy money",
            "cures", "no side effects", "sure win");

    private static final List<Pattern> RISKY_PATTERNS = List.of(
            Pattern.compile("\\d+\\s*k?\\s*(yen|dollars?)\\s+guaranteed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("anyone can (easily|surely)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("principal guaranteed", Pattern.CASE_INSENSITIVE));

    private static final String DISCLOSURE = "#PR";

    @Override
    public ComplianceResult check(Content content) {
        var violations = new ArrayList<String>();
        String text = (content.title() + " " + content.script());
        String lower = text.toLowerCase(Locale.ROOT);

        for (String phrase : BANNED_PHRASES) {
            if (lower.contains(phrase)) {
                violations.add("banned phrase: " + phrase);
            }
        }
        for (Pattern pattern : RISKY_PATTERNS) {
            if (pattern.matcher(text).find()) {
                violations.add("risky claim: " + pattern.pattern());
            }
        }
        boolean hasClaims = !violations.isEmpty();
        if (!text.contains(DISCLOSURE)) {
            violations.add("missing sponsorship disclosure");
        }

        if (violations.isEmpty()) {
            return new ComplianceResult(true, Severity.NONE, List.of());
        }
        return new ComplianceResult(false, hasClaims ? Severity.HIGH : Severity.MEDIUM, violations);
    }

    @Override
    public AutoFixResult autoFix(Content content) {
        String title = strip(content.title());
        String script = strip(content.script());
        if (!script.contains(DISCLOSURE)) {
            script = script + " " + DISCLOSURE;
        }
        var fixed = new Content(title, script, content.platform(), content.niche());
        return new AutoFixResult(check(fixed).isCompliant(), fixed);
    }

    private static String strip(String text) {
        if (text == null) return "";
        String result = text;
        for (String phrase : BANNED_PHRASES) {
            result = Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE)
                    .matcher(result).replaceAll("");
        }
        return result.replaceAll("\\s{2,}", " ").trim();
    }
}
