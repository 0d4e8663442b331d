package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;

import java.util.Comparator;
import java.util.Optional;

/**
 * One detected property of an event's content.
 *
 * <p>The label is derived from category and value only, so two equal findings
 * always produce the same label. Ownership findings never produce a label; their
 * value is the owner login used for reviewer requests. Summary, requirement and
 * suggestion findings are only rendered into comments.
 */
public record Finding(FindingCategory category, Severity severity, String value, String evidence) {

    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::category)
            .thenComparing(Finding::value)
            .thenComparing(Finding::severity)
            .thenComparing(f -> f.evidence() == null ? "" : f.evidence());

    public Finding {
        if (category == null) throw new IllegalArgumentException("category required");
        if (value == null || value.isBlank()) throw new IllegalArgumentException("value required");
        if (severity == null) severity = Severity.INFO;
    }

    public static Finding of(FindingCategory category, Severity severity, String value) {
        return new Finding(category, severity, value, null);
    }

    public Optional<String> label() {
        return switch (category) {
            case LANGUAGE -> Optional.of("lang:" + value);
            case SIZE -> Optional.of("size:" + value);
            case SECURITY -> Optional.of("security:" + value);
            case PRIORITY -> Optional.of("priority:" + value);
            case CLASSIFICATION -> Optional.of(classificationLabel(value));
            case OWNERSHIP, SUMMARY, REQUIREMENT, SUGGESTION -> Optional.empty();
        };
    }

    public boolean isCriticalSecurity() {
        return category == FindingCategory.SECURITY && severity == Severity.CRITICAL;
    }

    private static String classificationLabel(String value) {
        return "feature".equals(value) ? "enhancement" : value;
    }
}
