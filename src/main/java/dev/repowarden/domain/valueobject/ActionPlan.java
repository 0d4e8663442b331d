package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.IssueState;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Deduplicated set of platform effects derived from one event.
 *
 * <p>All collections are sorted sets, so equal inputs give equal plans no matter
 * in which order findings were merged. {@code commentBody}, {@code statusCheck}
 * and {@code issueState} are nullable.
 */
public record ActionPlan(
        SortedSet<String> labelsToAdd,
        SortedSet<String> labelsToRemove,
        SortedSet<String> reviewersToRequest,
        SortedSet<String> assigneesToAdd,
        String commentBody,
        StatusCheck statusCheck,
        IssueState issueState
) {
    public ActionPlan {
        labelsToAdd = frozen(labelsToAdd);
        labelsToRemove = frozen(labelsToRemove);
        reviewersToRequest = frozen(reviewersToRequest);
        assigneesToAdd = frozen(assigneesToAdd);
    }

    public static ActionPlan empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> comment() {
        return Optional.ofNullable(commentBody);
    }

    public Optional<StatusCheck> status() {
        return Optional.ofNullable(statusCheck);
    }

    public Optional<IssueState> targetState() {
        return Optional.ofNullable(issueState);
    }

    public boolean isEmpty() {
        return labelsToAdd.isEmpty() && labelsToRemove.isEmpty() && reviewersToRequest.isEmpty()
                && assigneesToAdd.isEmpty() && commentBody == null && statusCheck == null && issueState == null;
    }

    private static SortedSet<String> frozen(Collection<String> values) {
        return Collections.unmodifiableSortedSet(values == null ? new TreeSet<>() : new TreeSet<>(values));
    }

    public static final class Builder {
        private final SortedSet<String> labelsToAdd = new TreeSet<>();
        private final SortedSet<String> labelsToRemove = new TreeSet<>();
        private final SortedSet<String> reviewers = new TreeSet<>();
        private final SortedSet<String> assignees = new TreeSet<>();
        private String commentBody;
        private StatusCheck statusCheck;
        private IssueState issueState;

        private Builder() {}

        public Builder addLabel(String label) {
            labelsToAdd.add(label);
            labelsToRemove.remove(label);
            return this;
        }

        /** Ignored for labels that are also being added. */
        public Builder removeLabel(String label) {
            if (!labelsToAdd.contains(label)) labelsToRemove.add(label);
            return this;
        }

        public Builder requestReviewer(String login) {
            reviewers.add(login);
            return this;
        }

        public Builder addAssignee(String login) {
            assignees.add(login);
            return this;
        }

        public Builder comment(String body) {
            this.commentBody = body;
            return this;
        }

        public Builder status(StatusCheck check) {
            this.statusCheck = check;
            return this;
        }

        public Builder issueState(IssueState state) {
            this.issueState = state;
            return this;
        }

        public ActionPlan build() {
            return new ActionPlan(labelsToAdd, labelsToRemove, reviewers, assignees,
                    commentBody, statusCheck, issueState);
        }
    }
}
