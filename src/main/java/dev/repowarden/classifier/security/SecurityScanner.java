package dev.repowarden.classifier.security;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Secret, dangerous-call and SQL-concatenation scan over added lines.
 *
 * <p>Emits at most one finding per (rule, file): repeated hits in the same file
 * collapse into the first one, whose {@code path:line} is kept as evidence. The
 * matched text itself is never copied into a finding, since it may be a live secret.
 */
@Component
public class SecurityScanner implements Classifier {

    private static final Logger log = LoggerFactory.getLogger(SecurityScanner.class);

    @Override
    public ClassifierType getType() {
        return ClassifierType.SECURITY;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind.isPullRequestChange();
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        return scan(input.files());
    }

    public List<Finding> scan(List<ChangedFile> files) {
        List<Finding> findings = new ArrayList<>();
        List<ChangedFile> ordered = files.stream()
                .sorted(Comparator.comparing(ChangedFile::path))
                .toList();
        for (ChangedFile file : ordered) {
            for (SecurityRule rule : SecurityRule.values()) {
                firstHit(file, rule).ifPresent(line -> findings.add(new Finding(
                        FindingCategory.SECURITY, rule.severity(), rule.tag(), file.path() + ":" + line)));
            }
        }
        if (!findings.isEmpty()) {
            log.info("Security scan flagged {} issue(s) across {} file(s)", findings.size(), files.size());
        }
        return findings;
    }

    private Optional<Integer> firstHit(ChangedFile file, SecurityRule rule) {
        return file.addedLines().stream()
                .filter(line -> rule.matches(line.text()))
                .map(ChangedFile.AddedLine::lineNumber)
                .findFirst();
    }
}
