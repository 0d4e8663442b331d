package dev.repowarden.classifier;

import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.valueobject.Finding;

import java.util.List;

/**
 * Contract for rule-based analyzers.
 * Classifiers are discovered via List&lt;Classifier&gt; injection: implement this and
 * annotate with @Component. Implementations must be stateless so the registry
 * can run them concurrently.
 */
public interface Classifier {

    ClassifierType getType();

    boolean supports(EventKind kind);

    List<Finding> classify(ClassificationInput input);
}
