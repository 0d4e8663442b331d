package dev.repowarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Keyword tables for issue triage. Matching is case-insensitive substring; list
 * order decides which keyword is reported as evidence.
 */
@ConfigurationProperties(prefix = "repowarden.triage")
public record TriageProperties(List<String> bugKeywords, List<String> featureKeywords,
                               List<String> questionKeywords, List<String> urgencyKeywords) {

    public static final List<String> DEFAULT_BUG = List.of(
            "bug", "error", "broken", "crash", "exception", "not working", "fails");
    public static final List<String> DEFAULT_FEATURE = List.of(
            "feature", "enhancement", "proposal", "support for", "would be nice");
    public static final List<String> DEFAULT_QUESTION = List.of(
            "question", "how do i", "how to", "how can", "?");
    public static final List<String> DEFAULT_URGENCY = List.of(
            "urgent", "critical", "blocker", "asap");

    public TriageProperties {
        bugKeywords = orDefault(bugKeywords, DEFAULT_BUG);
        featureKeywords = orDefault(featureKeywords, DEFAULT_FEATURE);
        questionKeywords = orDefault(questionKeywords, DEFAULT_QUESTION);
        urgencyKeywords = orDefault(urgencyKeywords, DEFAULT_URGENCY);
    }

    public static TriageProperties defaults() {
        return new TriageProperties(null, null, null, null);
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        return configured == null || configured.isEmpty() ? fallback : List.copyOf(configured);
    }
}
