package dev.repowarden.classifier.review;

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
import java.util.Optional;

/**
 * Reviews a newly opened pull request for code without tests, oversized files and
 * wide changes without documentation. Each failed {@link Requirement} is one finding;
 * large files get one finding per file.
 */
@Component
public class PullRequestRequirementsClassifier implements Classifier {

    static final int LARGE_FILE_CHANGES = 300;
    static final int DOCS_EXPECTED_ABOVE_FILES = 5;

    private static final List<String> CODE_EXTENSIONS = List.of(".py", ".js", ".ts", ".java", ".go");
    private static final List<String> DOC_EXTENSIONS = List.of(".md", ".rst", ".txt");

    @Override
    public ClassifierType getType() {
        return ClassifierType.PR_REQUIREMENTS;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind == EventKind.PULL_REQUEST_OPENED;
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        List<ChangedFile> files = input.files();
        List<Finding> findings = new ArrayList<>();

        boolean hasTests = files.stream().anyMatch(f -> lower(f).contains("test"));
        Optional<ChangedFile> firstCode = files.stream().filter(f -> endsWithAny(lower(f), CODE_EXTENSIONS)).findFirst();
        if (firstCode.isPresent() && !hasTests) {
            findings.add(new Finding(FindingCategory.REQUIREMENT, Severity.WARN,
                    Requirement.MISSING_TESTS.tag(), firstCode.get().path()));
        }

        for (ChangedFile file : files) {
            if (file.changedLines() > LARGE_FILE_CHANGES) {
                findings.add(new Finding(FindingCategory.REQUIREMENT, Severity.WARN,
                        Requirement.LARGE_FILE.tag(), file.path()));
            }
        }

        boolean hasDocs = files.stream().anyMatch(f -> endsWithAny(lower(f), DOC_EXTENSIONS));
        if (files.size() > DOCS_EXPECTED_ABOVE_FILES && !hasDocs) {
            findings.add(new Finding(FindingCategory.REQUIREMENT, Severity.INFO,
                    Requirement.MISSING_DOCS.tag(), files.size() + " files changed"));
        }
        return findings;
    }

    private static String lower(ChangedFile file) {
        return file.path().toLowerCase(Locale.ROOT);
    }

    private static boolean endsWithAny(String path, List<String> suffixes) {
        return suffixes.stream().anyMatch(path::endsWith);
    }
}
