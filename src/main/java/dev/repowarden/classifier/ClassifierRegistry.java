package dev.repowarden.classifier;

import dev.repowarden.config.PipelineProperties;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.valueobject.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs the fixed classifier set over one event and merges the findings.
 *
 * <p>Classifiers are independent, so they fan out on the classifier executor and
 * the results are merged into a sorted set. A classifier that throws or times
 * out contributes no findings and is left out of the completed set; the others
 * are unaffected.
 */
@Component
public class ClassifierRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClassifierRegistry.class);

    private final List<Classifier> classifiers;
    private final PipelineProperties pipelineProperties;
    private final Executor classifierExecutor;
    private final Duration classifierTimeout;

    public ClassifierRegistry(List<Classifier> classifiers,
                              PipelineProperties pipelineProperties,
                              @Qualifier("classifierExecutor") Executor classifierExecutor) {
        this.classifiers = classifiers.stream()
                .sorted(Comparator.comparing(Classifier::getType))
                .toList();
        this.pipelineProperties = pipelineProperties;
        this.classifierExecutor = classifierExecutor;
        this.classifierTimeout = pipelineProperties.classifierTimeout();
    }

    public ClassificationResult classify(ClassificationInput input) {
        List<Classifier> eligible = classifiers.stream()
                .filter(c -> isEnabled(c.getType()))
                .filter(c -> c.supports(input.kind()))
                .toList();

        log.debug("Classifiers for {} on {}: {}", input.kind(), input.event().repository(),
                eligible.stream().map(c -> c.getType().name()).toList());

        Map<ClassifierType, CompletableFuture<List<Finding>>> futures = new EnumMap<>(ClassifierType.class);
        for (Classifier c : eligible) {
            futures.put(c.getType(), CompletableFuture.supplyAsync(() -> c.classify(input), classifierExecutor)
                    .orTimeout(classifierTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        log.warn("{} classifier failed for delivery {}: {}",
                                c.getType(), input.event().deliveryId(), ex.getMessage());
                        return null;
                    }));
        }

        SortedSet<Finding> merged = new TreeSet<>(Finding.ORDER);
        Set<ClassifierType> completed = EnumSet.noneOf(ClassifierType.class);
        futures.forEach((type, future) -> {
            List<Finding> findings = future.join();
            if (findings != null) {
                merged.addAll(findings);
                completed.add(type);
            }
        });
        return new ClassificationResult(List.copyOf(merged), completed);
    }

    public List<ClassifierType> registeredTypes() {
        return classifiers.stream().map(Classifier::getType).toList();
    }

    private boolean isEnabled(ClassifierType type) {
        return switch (type) {
            case SECURITY -> pipelineProperties.securityScanning();
            case OWNERSHIP -> pipelineProperties.autoAssignReviewers();
            case LANGUAGE, SIZE, CONTENT_TYPE, KEYWORD_TRIAGE, PRIORITY,
                 PR_SUMMARY, PR_REQUIREMENTS, ISSUE_TEMPLATE -> true;
        };
    }
}
