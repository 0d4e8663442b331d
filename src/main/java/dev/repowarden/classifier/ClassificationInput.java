package dev.repowarden.classifier;

import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.event.IssuePayload;
import dev.repowarden.domain.event.RepositoryEvent;
import dev.repowarden.domain.valueobject.ChangedFile;

import java.util.List;

/**
 * What classifiers see: the event plus, for pull requests, its changed files.
 */
public record ClassificationInput(RepositoryEvent event, List<ChangedFile> files) {

    public ClassificationInput {
        if (event == null) throw new IllegalArgumentException("event required");
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static ClassificationInput ofIssue(RepositoryEvent event) {
        return new ClassificationInput(event, List.of());
    }

    public EventKind kind() {
        return event.kind();
    }

    /** Issue title and body, empty for other events. */
    public String text() {
        return event.issue().map(IssuePayload::text).orElse("");
    }

    public String author() {
        return event.actor();
    }
}
