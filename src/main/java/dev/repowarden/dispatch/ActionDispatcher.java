package dev.repowarden.dispatch;

import dev.repowarden.config.DispatchProperties;
import dev.repowarden.domain.enums.ActionType;
import dev.repowarden.domain.enums.OutcomeStatus;
import dev.repowarden.domain.valueobject.ActionOutcome;
import dev.repowarden.domain.valueobject.ActionPlan;
import dev.repowarden.domain.valueobject.DispatchOutcome;
import dev.repowarden.domain.valueobject.StatusCheck;
import dev.repowarden.exception.PlatformException;
import dev.repowarden.planner.CommentMarkers;
import dev.repowarden.platform.EffectResult;
import dev.repowarden.platform.EffectStatus;
import dev.repowarden.platform.PlatformTarget;
import dev.repowarden.platform.RepositoryPlatform;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Executes an {@link ActionPlan} against the platform.
 *
 * <p>Steps run in {@link ActionType} order and never abort each other: a failed
 * label does not stop the comment. Transient failures (rate limit, 5xx, network,
 * open circuit) are retried with exponential backoff; permanent ones are recorded
 * as FAILED on the first attempt. State that already holds is reported SKIPPED.
 *
 * <p>Comments are stamped with one digest marker per section. If every section
 * marker already appears in a bot comment the comment is skipped, so a redelivered
 * event never posts twice even when a welcome section has since dropped out.
 */
@Component
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);
    private static final String ACTIONS_METRIC = "repowarden.dispatch.actions";

    private final RepositoryPlatform platform;
    private final MeterRegistry meterRegistry;
    private final RetryConfig exceptionRetry;
    private final RetryConfig batchRetry;

    public ActionDispatcher(RepositoryPlatform platform, DispatchProperties properties, MeterRegistry meterRegistry) {
        this.platform = platform;
        this.meterRegistry = meterRegistry;
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                properties.initialBackoff(), properties.backoffMultiplier());
        this.exceptionRetry = RetryConfig.custom()
                .maxAttempts(properties.maxAttempts())
                .intervalFunction(backoff)
                .retryOnException(ActionDispatcher::isTransient)
                .build();
        this.batchRetry = RetryConfig.<Map<String, EffectResult>>custom()
                .maxAttempts(properties.maxAttempts())
                .intervalFunction(backoff)
                .retryOnException(ActionDispatcher::isTransient)
                .retryOnResult(pending -> !pending.isEmpty())
                .build();
    }

    public DispatchOutcome dispatch(ActionPlan plan, PlatformTarget target) {
        return dispatch(null, plan, target);
    }

    public DispatchOutcome dispatch(String deliveryId, ActionPlan plan, PlatformTarget target) {
        List<ActionOutcome> outcomes = new ArrayList<>();

        if (!plan.labelsToRemove().isEmpty()) {
            outcomes.addAll(batch(ActionType.REMOVE_LABEL, plan.labelsToRemove(),
                    pending -> platform.applyLabels(target, Set.of(), pending)));
        }
        if (!plan.labelsToAdd().isEmpty()) {
            outcomes.addAll(batch(ActionType.ADD_LABEL, plan.labelsToAdd(),
                    pending -> platform.applyLabels(target, pending, Set.of())));
        }
        if (!plan.reviewersToRequest().isEmpty()) {
            outcomes.addAll(batch(ActionType.REQUEST_REVIEWER, plan.reviewersToRequest(),
                    pending -> platform.requestReviewers(target, pending)));
        }
        if (!plan.assigneesToAdd().isEmpty()) {
            outcomes.addAll(batch(ActionType.ADD_ASSIGNEE, plan.assigneesToAdd(),
                    pending -> platform.addAssignees(target, pending)));
        }
        plan.status().ifPresent(check -> outcomes.add(status(check, target)));
        plan.targetState().ifPresent(state -> outcomes.add(single(ActionType.SET_ISSUE_STATE, state.apiValue(),
                () -> platform.closeOrReopen(target, state))));
        plan.comment().ifPresent(body -> outcomes.add(comment(body, target)));

        outcomes.forEach(this::record);
        DispatchOutcome outcome = DispatchOutcome.of(deliveryId, outcomes);
        log.info("Dispatched {} action(s) to {}#{}: applied={}, skipped={}, failed={}",
                outcomes.size(), target.repository(), target.number(),
                outcome.count(OutcomeStatus.APPLIED), outcome.count(OutcomeStatus.SKIPPED),
                outcome.count(OutcomeStatus.FAILED));
        return outcome;
    }

    private ActionOutcome status(StatusCheck check, PlatformTarget target) {
        if (target.headSha() == null) {
            return ActionOutcome.skipped(ActionType.SET_STATUS, check.context(), "no head commit");
        }
        return single(ActionType.SET_STATUS, check.context(), () -> platform.setStatusCheck(target, check));
    }

    private ActionOutcome comment(String body, PlatformTarget target) {
        String subject = CommentMarkers.digestOf(body);
        List<String> markers = CommentMarkers.sectionDigests(body);
        try {
            boolean posted = withRetry("comment-lookup",
                    () -> markers.stream().allMatch(marker -> platform.hasBotComment(target, marker)));
            if (posted) {
                return ActionOutcome.skipped(ActionType.POST_COMMENT, subject, "comment already posted");
            }
        } catch (RuntimeException e) {
            log.warn("Comment lookup on {}#{} failed: {}", target.repository(), target.number(), e.getMessage());
            return ActionOutcome.failed(ActionType.POST_COMMENT, subject, e.getMessage());
        }
        String stamped = body + "\n\n" + String.join("\n", markers);
        return single(ActionType.POST_COMMENT, subject, () -> platform.postComment(target, stamped));
    }

    private ActionOutcome single(ActionType action, String subject, Supplier<EffectStatus> call) {
        try {
            EffectStatus status = withRetry(action.name(), call);
            return switch (status) {
                case APPLIED -> ActionOutcome.applied(action, subject);
                case UNCHANGED -> ActionOutcome.skipped(action, subject, "already in desired state");
                case FAILED -> ActionOutcome.failed(action, subject, "platform reported failure");
            };
        } catch (RuntimeException e) {
            log.warn("{} '{}' failed: {}", action, subject, e.getMessage());
            return ActionOutcome.failed(action, subject, e.getMessage());
        }
    }

    /**
     * Runs a per-item write, retrying only the items that failed transiently.
     * Items that succeed on an earlier attempt are not sent again.
     */
    private List<ActionOutcome> batch(ActionType action, Collection<String> items,
                                      Function<Set<String>, Map<String, EffectResult>> call) {
        Map<String, EffectResult> settled = new TreeMap<>();
        Set<String> pending = new TreeSet<>(items);
        Retry retry = Retry.of(action.name(), batchRetry);
        Supplier<Map<String, EffectResult>> attempt = () -> {
            Map<String, EffectResult> results = call.apply(new TreeSet<>(pending));
            Map<String, EffectResult> transientFailures = new TreeMap<>();
            results.forEach((item, result) -> {
                if (result.isTransientFailure()) {
                    transientFailures.put(item, result);
                } else {
                    settled.put(item, result);
                    pending.remove(item);
                }
            });
            return transientFailures;
        };
        try {
            settled.putAll(Retry.decorateSupplier(retry, attempt).get());
        } catch (RuntimeException e) {
            log.warn("{} failed for {}: {}", action, pending, e.getMessage());
            pending.forEach(item -> settled.put(item, failure(e)));
        }

        List<ActionOutcome> outcomes = new ArrayList<>();
        for (String item : items) {
            EffectResult result = settled.get(item);
            if (result == null) {
                outcomes.add(ActionOutcome.failed(action, item, "no result from platform"));
                continue;
            }
            outcomes.add(switch (result.status()) {
                case APPLIED -> ActionOutcome.applied(action, item);
                case UNCHANGED -> ActionOutcome.skipped(action, item, result.message());
                case FAILED -> ActionOutcome.failed(action, item, result.message());
            });
        }
        return outcomes;
    }

    private <T> T withRetry(String name, Supplier<T> call) {
        return Retry.decorateSupplier(Retry.of(name, exceptionRetry), call).get();
    }

    private void record(ActionOutcome outcome) {
        meterRegistry.counter(ACTIONS_METRIC,
                "action", outcome.action().name().toLowerCase(Locale.ROOT),
                "status", outcome.status().name().toLowerCase(Locale.ROOT)).increment();
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof PlatformException platformException) return platformException.isTransient();
        return t instanceof CallNotPermittedException || t instanceof RequestNotPermitted;
    }

    private static EffectResult failure(RuntimeException e) {
        if (e instanceof PlatformException platformException) return EffectResult.failed(platformException);
        return new EffectResult(EffectStatus.FAILED, e.getMessage(), false);
    }
}
