package dev.repowarden.classifier.security;

import dev.repowarden.domain.enums.Severity;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled pattern table for the security scan, in scan order.
 *
 * <p>Patterns run per added line with no knowledge of the target language's grammar:
 * they will flag test fixtures and miss obfuscated secrets.
 */
public enum SecurityRule {

    HARDCODED_CREDENTIAL("hardcoded-credential", "Hardcoded credential", Severity.CRITICAL, List.of(
            Pattern.compile("(?i)[\\w.-]*(password|passwd|pwd|api[_-]?key|secret|token)[\\w.-]*[\"']?\\s*[:=]\\s*[\"'][^\"']+[\"']"),
            Pattern.compile("AKIA[0-9A-Z]{16}"),
            Pattern.compile("gh[pousr]_[A-Za-z0-9]{36,}"),
            Pattern.compile("(sk|rk)_live_[0-9A-Za-z]{8,}"),
            Pattern.compile("-----BEGIN (RSA |EC |DSA |OPENSSH )?PRIVATE KEY-----"))),

    DANGEROUS_CALL("dangerous-call", "Dangerous eval/exec call", Severity.CRITICAL, List.of(
            Pattern.compile("(?<![\\w$])(eval|exec|system|shell_exec|passthru|popen)\\s*\\("),
            Pattern.compile("shell\\s*=\\s*True"))),

    SQL_INJECTION_RISK("sql-injection-risk", "Possible SQL injection", Severity.WARN, List.of(
            Pattern.compile("(?i)(execute|query)\\s*\\(\\s*[\"'].*\\+.*"),
            Pattern.compile("(?i)(execute|query)\\s*\\(\\s*f[\"']"),
            Pattern.compile("(?i)[\"'`]\\s*(select|insert|update|delete)\\b[^\"'`]*[\"'`]\\s*\\+")));

    private final String tag;
    private final String title;
    private final Severity severity;
    private final List<Pattern> patterns;

    SecurityRule(String tag, String title, Severity severity, List<Pattern> patterns) {
        this.tag = tag;
        this.title = title;
        this.severity = severity;
        this.patterns = patterns;
    }

    public String tag() { return tag; }

    public String title() { return title; }

    public Severity severity() { return severity; }

    public boolean matches(String line) {
        return patterns.stream().anyMatch(p -> p.matcher(line).find());
    }

    public static SecurityRule fromTag(String tag) {
        for (SecurityRule rule : values()) {
            if (rule.tag.equals(tag)) return rule;
        }
        throw new IllegalArgumentException("Unknown security rule: " + tag);
    }
}
