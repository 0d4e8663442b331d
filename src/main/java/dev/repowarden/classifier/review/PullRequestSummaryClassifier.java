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
import java.util.regex.Pattern;

/**
 * Summarizes a newly opened pull request: a complexity rating from file and line
 * counts, plus the files whose added lines touch signatures, imports or decorators.
 *
 * <p>Only runs when a pull request is opened.
 */
@Component
public class PullRequestSummaryClassifier implements Classifier {

    public static final String COMPLEXITY_PREFIX = "complexity:";
    public static final String BREAKING_PREFIX = "breaking:";

    private static final List<Pattern> BREAKING_PATTERNS = List.of(
            Pattern.compile("^\\s*def\\s+\\w+\\([^)]*\\)\\s*->"),
            Pattern.compile("^\\s*class\\s+\\w+\\([^)]*\\):"),
            Pattern.compile("^\\s*import\\s+\\w+"),
            Pattern.compile("^\\s*from\\s+\\w+\\s+import"),
            Pattern.compile("^\\s*@\\w+"));

    public enum Complexity {
        LOW, MEDIUM, HIGH;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Complexity of(int changedLines, int fileCount) {
            int score = 0;
            if (changedLines > 500) score += 3;
            else if (changedLines > 200) score += 2;
            else if (changedLines > 50) score += 1;

            if (fileCount > 10) score += 2;
            else if (fileCount > 5) score += 1;

            if (score >= 4) return HIGH;
            return score >= 2 ? MEDIUM : LOW;
        }
    }

    @Override
    public ClassifierType getType() {
        return ClassifierType.PR_SUMMARY;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind == EventKind.PULL_REQUEST_OPENED;
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        List<ChangedFile> files = input.files();
        int changed = files.stream().mapToInt(ChangedFile::changedLines).sum();
        Complexity complexity = Complexity.of(changed, files.size());

        List<Finding> findings = new ArrayList<>();
        findings.add(new Finding(FindingCategory.SUMMARY,
                complexity == Complexity.HIGH ? Severity.WARN : Severity.INFO,
                COMPLEXITY_PREFIX + complexity.tag(),
                "%d file(s), %d line(s) changed".formatted(files.size(), changed)));
        for (ChangedFile file : files) {
            firstBreakingLine(file).ifPresent(line -> findings.add(new Finding(FindingCategory.SUMMARY,
                    Severity.WARN, BREAKING_PREFIX + file.path(), file.path() + ":" + line.lineNumber())));
        }
        return findings;
    }

    static Optional<ChangedFile.AddedLine> firstBreakingLine(ChangedFile file) {
        return file.addedLines().stream()
                .filter(line -> BREAKING_PATTERNS.stream().anyMatch(p -> p.matcher(line.text()).find()))
                .findFirst();
    }
}
