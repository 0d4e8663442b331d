package dev.repowarden.classifier.content;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.Finding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Tags pull requests by the kind of files they touch (docs, tests, config, ...).
 * A file may match several content types.
 */
@Component
public class ContentTypeClassifier implements Classifier {

    enum ContentType {
        DOCUMENTATION("documentation", p -> endsWithAny(p, ".md", ".txt", ".rst", ".adoc") || p.startsWith("docs/")),
        TESTS("tests", ContentTypeClassifier::isTestPath),
        CONFIG("config", p -> endsWithAny(p, ".yml", ".yaml", ".json", ".toml", ".ini", ".cfg", ".properties")),
        STYLING("styling", p -> endsWithAny(p, ".css", ".scss", ".sass", ".less")),
        FRONTEND("frontend", p -> endsWithAny(p, ".html", ".htm", ".vue", ".svelte")),
        DATABASE("database", p -> endsWithAny(p, ".sql") || p.contains("migrations/")),
        DOCKER("docker", p -> fileName(p).startsWith("dockerfile") || fileName(p).startsWith("docker-compose")
                || fileName(p).equals(".dockerignore")),
        CI_CD("ci/cd", p -> p.startsWith(".github/workflows/") || p.startsWith(".circleci/")
                || fileName(p).startsWith(".gitlab-ci") || fileName(p).equals(".travis.yml")
                || fileName(p).equals("jenkinsfile"));

        private final String tag;
        private final Predicate<String> matcher;

        ContentType(String tag, Predicate<String> matcher) {
            this.tag = tag;
            this.matcher = matcher;
        }
    }

    @Override
    public ClassifierType getType() {
        return ClassifierType.CONTENT_TYPE;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind.isPullRequestChange();
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        Map<String, String> firstPathByTag = new TreeMap<>();
        for (ChangedFile file : input.files()) {
            String path = file.path().toLowerCase(Locale.ROOT);
            for (ContentType type : ContentType.values()) {
                if (type.matcher.test(path)) {
                    firstPathByTag.merge(type.tag, file.path(), (a, b) -> a.compareTo(b) <= 0 ? a : b);
                }
            }
        }
        List<Finding> findings = new ArrayList<>();
        firstPathByTag.forEach((tag, path) ->
                findings.add(new Finding(FindingCategory.CLASSIFICATION, Severity.INFO, tag, path)));
        return findings;
    }

    static boolean isTestPath(String path) {
        String name = fileName(path);
        return path.contains("/test/") || path.startsWith("test/") || path.contains("/tests/")
                || path.startsWith("tests/") || path.contains("__tests__/")
                || name.startsWith("test_") || name.contains("_test.") || name.contains(".test.")
                || name.contains(".spec.") || name.endsWith("test.java") || name.endsWith("tests.java");
    }

    private static boolean endsWithAny(String path, String... suffixes) {
        for (String suffix : suffixes) {
            if (path.endsWith(suffix)) return true;
        }
        return false;
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
