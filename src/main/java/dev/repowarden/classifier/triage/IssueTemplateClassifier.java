package dev.repowarden.classifier.triage;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.event.IssuePayload;
import dev.repowarden.domain.valueobject.Finding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Points out what a new issue is missing compared to a good report.
 */
@Component
public class IssueTemplateClassifier implements Classifier {

    static final int MIN_BODY_LENGTH = 50;

    public enum Suggestion {
        MORE_DETAILS("more-details", "Consider providing more details about the issue"),
        REPRODUCTION_STEPS("reproduction-steps", "For bug reports, please include steps to reproduce"),
        USE_CASE("use-case", "For feature requests, please explain the use case");

        private final String tag;
        private final String text;

        Suggestion(String tag, String text) {
            this.tag = tag;
            this.text = text;
        }

        public String tag() { return tag; }

        public String text() { return text; }

        public static Suggestion fromTag(String tag) {
            for (Suggestion suggestion : values()) {
                if (suggestion.tag.equals(tag)) return suggestion;
            }
            throw new IllegalArgumentException("Unknown suggestion: " + tag);
        }
    }

    @Override
    public ClassifierType getType() {
        return ClassifierType.ISSUE_TEMPLATE;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind == EventKind.ISSUE_OPENED;
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        IssuePayload issue = input.event().issue().orElse(null);
        if (issue == null) return List.of();
        String title = issue.title() == null ? "" : issue.title().toLowerCase(Locale.ROOT);
        String body = issue.body() == null ? "" : issue.body().toLowerCase(Locale.ROOT);

        List<Finding> findings = new ArrayList<>();
        if (body.length() < MIN_BODY_LENGTH) {
            findings.add(suggest(Suggestion.MORE_DETAILS, body.length() + " characters"));
        }
        if (title.contains("bug") && !body.contains("reproduce")) {
            findings.add(suggest(Suggestion.REPRODUCTION_STEPS, "title mentions a bug"));
        }
        if (title.contains("feature") && !body.contains("why")) {
            findings.add(suggest(Suggestion.USE_CASE, "title mentions a feature"));
        }
        return findings;
    }

    private static Finding suggest(Suggestion suggestion, String evidence) {
        return new Finding(FindingCategory.SUGGESTION, Severity.INFO, suggestion.tag(), evidence);
    }
}
