package dev.repowarden.classifier;

import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.valueobject.Finding;

import java.util.List;
import java.util.Set;

/**
 * Merged findings of one registry run, plus the classifiers that finished. A classifier
 * that threw or timed out is absent from {@code completed}, so an empty result from it
 * cannot be mistaken for a clean one.
 */
public record ClassificationResult(List<Finding> findings, Set<ClassifierType> completed) {

    public ClassificationResult {
        findings = List.copyOf(findings);
        completed = Set.copyOf(completed);
    }

    public boolean hasCompleted(ClassifierType type) {
        return completed.contains(type);
    }
}
