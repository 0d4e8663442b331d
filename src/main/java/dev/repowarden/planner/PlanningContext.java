package dev.repowarden.planner;

import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.valueobject.MergedPullRequest;

import java.util.List;
import java.util.Set;

/**
 * Facts the planner needs beyond findings. Gathered by the router from the event
 * and from platform queries, so planning itself stays a pure function.
 *
 * @param completedClassifiers classifiers that finished for this event; one that failed
 *                             leaves its labels and status untouched
 * @param firstTimeContributor actor has no merged pull request in the repository
 * @param welcomeAlreadyPosted a welcome marker already exists on the target
 * @param sourceCommentId      comment or review that triggered a command, 0 otherwise
 */
public record PlanningContext(
        EventKind kind,
        String repository,
        String actor,
        Set<ClassifierType> completedClassifiers,
        boolean firstTimeContributor,
        boolean welcomeAlreadyPosted,
        long sourceCommentId,
        List<MergedPullRequest> recentMerged
) {
    public PlanningContext {
        completedClassifiers = completedClassifiers == null ? Set.of() : Set.copyOf(completedClassifiers);
        recentMerged = recentMerged == null ? List.of() : List.copyOf(recentMerged);
    }

    public static PlanningContext forIssue(EventKind kind, String repository, String actor) {
        return new PlanningContext(kind, repository, actor, Set.of(), false, false, 0L, List.of());
    }

    public static PlanningContext forCommand(EventKind kind, String repository, String actor,
                                             long sourceCommentId, List<MergedPullRequest> recentMerged) {
        return new PlanningContext(kind, repository, actor, Set.of(), false, false, sourceCommentId, recentMerged);
    }

    public boolean securityScanned() {
        return completedClassifiers.contains(ClassifierType.SECURITY);
    }

    public boolean sizeClassified() {
        return completedClassifiers.contains(ClassifierType.SIZE);
    }

    public boolean shouldWelcome() {
        return firstTimeContributor && !welcomeAlreadyPosted;
    }
}
