package dev.repowarden.platform;

import dev.repowarden.domain.enums.IssueState;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.MergedPullRequest;
import dev.repowarden.domain.valueobject.StatusCheck;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the pipeline needs from the code-hosting platform.
 *
 * <p>Implementations must be safe for concurrent use. Single-effect writes throw
 * {@link dev.repowarden.exception.TransientPlatformException} for rate limits and
 * outages, {@link dev.repowarden.exception.PermanentPlatformException} otherwise.
 * Batched writes report per item instead of throwing, so one bad label does not hide
 * the others. Writes are idempotent: asking for state that already holds returns
 * {@link EffectStatus#UNCHANGED}.
 */
public interface RepositoryPlatform {

    List<ChangedFile> fetchChangedFiles(PlatformTarget pullRequest);

    /** Whether the actor already has a merged pull request in the repository. */
    boolean fetchPriorContribution(String actor, PlatformTarget target);

    Map<String, EffectResult> applyLabels(PlatformTarget target, Set<String> add, Set<String> remove);

    Map<String, EffectResult> requestReviewers(PlatformTarget pullRequest, Set<String> reviewers);

    Map<String, EffectResult> addAssignees(PlatformTarget target, Set<String> assignees);

    EffectStatus postComment(PlatformTarget target, String body);

    EffectStatus setStatusCheck(PlatformTarget pullRequest, StatusCheck check);

    EffectStatus closeOrReopen(PlatformTarget target, IssueState state);

    /** Whether a comment written by this app on the target already contains the marker. */
    boolean hasBotComment(PlatformTarget target, String marker);

    List<MergedPullRequest> fetchRecentMergedPullRequests(PlatformTarget target, int limit);
}
