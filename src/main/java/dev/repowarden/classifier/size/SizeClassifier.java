package dev.repowarden.classifier.size;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.enums.SizeBucket;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.Finding;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Buckets the total number of changed lines. Always emits exactly one finding.
 */
@Component
public class SizeClassifier implements Classifier {

    @Override
    public ClassifierType getType() {
        return ClassifierType.SIZE;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind.isPullRequestChange();
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        int changed = input.files().stream().mapToInt(ChangedFile::changedLines).sum();
        SizeBucket bucket = SizeBucket.of(changed);
        Severity severity = bucket.ordinal() >= SizeBucket.LARGE.ordinal() ? Severity.WARN : Severity.INFO;
        String evidence = "%d lines changed across %d file(s)".formatted(changed, input.files().size());
        return List.of(new Finding(FindingCategory.SIZE, severity, bucket.tag(), evidence));
    }
}
