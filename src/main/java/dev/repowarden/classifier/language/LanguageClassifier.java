package dev.repowarden.classifier.language;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.Classifier;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Language;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.Finding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One finding per distinct supported language in the diff, labelled {@code lang:<tag>}.
 * Evidence is the first path (in path order) written in that language.
 */
@Component
public class LanguageClassifier implements Classifier {

    @Override
    public ClassifierType getType() {
        return ClassifierType.LANGUAGE;
    }

    @Override
    public boolean supports(EventKind kind) {
        return kind.isPullRequestChange();
    }

    @Override
    public List<Finding> classify(ClassificationInput input) {
        Map<String, String> firstPathByTag = new TreeMap<>();
        for (ChangedFile file : input.files()) {
            languageOf(file).ifPresent(language ->
                    firstPathByTag.merge(language.tag(), file.path(), (a, b) -> a.compareTo(b) <= 0 ? a : b));
        }
        List<Finding> findings = new ArrayList<>();
        firstPathByTag.forEach((tag, path) ->
                findings.add(new Finding(FindingCategory.LANGUAGE, Severity.INFO, tag, path)));
        return findings;
    }

    private Optional<Language> languageOf(ChangedFile file) {
        if (file.language() != null) {
            Optional<Language> tagged = Language.fromTag(file.language());
            if (tagged.isPresent()) return tagged;
        }
        String firstLine = file.addedLines().isEmpty() ? null : file.addedLines().get(0).text();
        return Language.detect(file.path(), firstLine);
    }
}
