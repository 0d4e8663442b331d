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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a new issue as bug, feature or question.
 * Categories are tried in that order and the first one with a matching keyword wins.
 */
@Component
public class KeywordTriageClassifier implements Classifier {

    private final Map<String, List<String>> keywordsByCategory = new LinkedHashMap<>();

    public KeywordTriageClassifier(TriageProperties triageProperties) {
        keywordsByCategory.put("bug", triageProperties.bugKeywords());
        keywordsByCategory.put("feature", triageProperties.featureKeywords());
        keywordsByCategory.put("question", triageProperties.questionKeywords());
    }

    @Override
    public ClassifierType getType() {
        return ClassifierType.KEYWORD_TRIAGE;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind == EventKind.ISSUE_OPENED;
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        String text = input.text();
        for (Map.Entry<String, List<String>> entry : keywordsByCategory.entrySet()) {
            Optional<String> keyword = KeywordMatcher.firstMatch(text, entry.getValue());
            if (keyword.isPresent()) {
                return List.of(new Finding(FindingCategory.CLASSIFICATION, Severity.INFO,
                        entry.getKey(), "keyword: " + keyword.get()));
            }
        }
        return List.of();
    }
}
