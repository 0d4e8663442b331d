package dev.repowarden.classifier.ownership;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.config.OwnershipProperties;
import dev.repowarden.config.OwnershipProperties.OwnerRule;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.Finding;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps changed paths to owners through the configured directory table.
 *
 * <p>Each file goes to the owner of its longest matching prefix. Owners who touch
 * the most files come first; the pull request author is never requested and the
 * list is capped at {@code maxReviewers}. Findings carry the owner login and
 * produce no label.
 */
@Component
public class OwnershipClassifier implements Classifier {

    private final List<OwnerRule> rules;
    private final int maxReviewers;

    public OwnershipClassifier(OwnershipProperties ownershipProperties) {
        this.rules = ownershipProperties.rules().stream()
                .filter(r -> r.pathPrefix() != null && r.owner() != null && !r.owner().isBlank())
                .sorted(Comparator.comparingInt((OwnerRule r) -> r.pathPrefix().length()).reversed())
                .toList();
        this.maxReviewers = ownershipProperties.maxReviewers();
    }

    @Override
    public ClassifierType getType() {
        return ClassifierType.OWNERSHIP;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind.isPullRequestChange();
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        Map<String, Integer> filesByOwner = new TreeMap<>();
        Map<String, String> prefixByOwner = new TreeMap<>();
        for (ChangedFile file : input.files()) {
            ownerOf(file.path()).ifPresent(rule -> {
                String owner = normalize(rule.owner());
                if (owner.equalsIgnoreCase(input.author())) return;
                filesByOwner.merge(owner, 1, Integer::sum);
                prefixByOwner.putIfAbsent(owner, rule.pathPrefix());
            });
        }
        return filesByOwner.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(maxReviewers)
                .map(e -> new Finding(FindingCategory.OWNERSHIP, Severity.INFO, e.getKey(),
                        "%d file(s) under %s".formatted(e.getValue(), prefixByOwner.get(e.getKey()))))
                .toList();
    }

    private Optional<OwnerRule> ownerOf(String path) {
        return rules.stream().filter(r -> path.startsWith(r.pathPrefix())).findFirst();
    }

    private static String normalize(String owner) {
        String trimmed = owner.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }
}
