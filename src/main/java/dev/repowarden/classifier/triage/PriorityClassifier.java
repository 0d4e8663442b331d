package dev.repowarden.classifier.triage;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.config.TriageProperties;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.valueobject.Finding;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags urgent issues. Default priority is implicit and never labelled.
 */
@Component
public class PriorityClassifier implements Classifier {

    static final String URGENT = "urgent";

    private final List<String> urgencyKeywords;

    public PriorityClassifier(TriageProperties triageProperties) {
        this.urgencyKeywords = triageProperties.urgencyKeywords();
    }

    @Override
    public ClassifierType getType() {
        return ClassifierType.PRIORITY;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind == EventKind.ISSUE_OPENED;
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        return KeywordMatcher.firstMatch(input.text(), urgencyKeywords)
                .map(k -> List.of(new Finding(FindingCategory.PRIORITY, Severity.CRITICAL, URGENT, "keyword: " + k)))
                .orElse(List.of());
    }
}
