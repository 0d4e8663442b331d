package dev.repowarden.dispatch;

import dev.repowarden.config.DispatchProperties;
import dev.repowarden.domain.enums.ActionType;
import dev.repowarden.domain.enums.CheckState;
import dev.repowarden.domain.enums.IssueState;
import dev.repowarden.domain.enums.OutcomeStatus;
import dev.repowarden.domain.valueobject.ActionOutcome;
import dev.repowarden.domain.valueobject.ActionPlan;
import dev.repowarden.domain.valueobject.DispatchOutcome;
import dev.repowarden.domain.valueobject.StatusCheck;
import dev.repowarden.exception.PermanentPlatformException;
import dev.repowarden.exception.TransientPlatformException;
import dev.repowarden.platform.PlatformTarget;
import dev.repowarden.support.FakeRepositoryPlatform;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ActionDispatcherTest {

    private static final PlatformTarget PR = new PlatformTarget("octocat/hello-world", 42, "abc123", 1L);
    private static final PlatformTarget ISSUE = new PlatformTarget("octocat/hello-world", 7, null, 1L);

    private FakeRepositoryPlatform platform;
    private SimpleMeterRegistry meterRegistry;
    private ActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        platform = new FakeRepositoryPlatform();
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new ActionDispatcher(platform,
                new DispatchProperties(3, Duration.ofMillis(1), 1.0), meterRegistry);
    }

    private static ActionPlan fullPlan() {
        return ActionPlan.builder()
                .addLabel("lang:java")
                .addLabel("size:small")
                .removeLabel("size:large")
                .requestReviewer("alice")
                .status(new StatusCheck("security-scan", CheckState.SUCCESS, "No issues found"))
                .comment("hello")
                .build();
    }

    @Nested
    @DisplayName("applying a plan")
    class Applying {

        @Test
        @DisplayName("every action runs in dispatch order and is applied")
        void appliesInOrder() {
            platform.labels.add("size:large");

            DispatchOutcome outcome = dispatcher.dispatch("d-1", fullPlan(), PR);

            assertThat(outcome.deliveryId()).isEqualTo("d-1");
            assertThat(outcome.actions()).extracting(ActionOutcome::action).containsExactly(
                    ActionType.REMOVE_LABEL, ActionType.ADD_LABEL, ActionType.ADD_LABEL,
                    ActionType.REQUEST_REVIEWER, ActionType.SET_STATUS, ActionType.POST_COMMENT);
            assertThat(outcome.count(OutcomeStatus.APPLIED)).isEqualTo(6);
            assertThat(platform.labels).containsExactly("lang:java", "size:small");
            assertThat(platform.reviewers).containsExactly("alice");
            assertThat(platform.botComments).singleElement().satisfies(body -> assertThat(body)
                    .startsWith("hello")
                    .contains("<!-- repowarden:digest:"));
        }

        @Test
        @DisplayName("dispatching the same plan twice performs no second write")
        void idempotent() {
            dispatcher.dispatch(fullPlan(), PR);
            int writes = platform.writeCalls;

            DispatchOutcome second = dispatcher.dispatch(fullPlan(), PR);

            assertThat(platform.writeCalls).isEqualTo(writes);
            assertThat(platform.commentPosts).isEqualTo(1);
            assertThat(second.actions()).allMatch(a -> a.status() == OutcomeStatus.SKIPPED);
        }

        @Test
        @DisplayName("status check without a head commit is skipped")
        void statusWithoutHead() {
            ActionPlan plan = ActionPlan.builder()
                    .status(new StatusCheck("security-scan", CheckState.SUCCESS, "ok"))
                    .build();

            DispatchOutcome outcome = dispatcher.dispatch(plan, ISSUE);

            assertThat(outcome.forAction(ActionType.SET_STATUS)).singleElement()
                    .satisfies(a -> assertThat(a.detail()).isEqualTo("no head commit"));
            assertThat(platform.statuses).isEmpty();
        }

        @Test
        @DisplayName("issue state already matching is skipped")
        void stateAlreadyMatching() {
            ActionPlan plan = ActionPlan.builder().issueState(IssueState.OPEN).build();

            DispatchOutcome outcome = dispatcher.dispatch(plan, ISSUE);

            assertThat(outcome.forAction(ActionType.SET_ISSUE_STATE)).singleElement()
                    .extracting(ActionOutcome::status).isEqualTo(OutcomeStatus.SKIPPED);
        }

        @Test
        @DisplayName("outcomes are counted per action and status")
        void metrics() {
            dispatcher.dispatch(fullPlan(), PR);

            assertThat(meterRegistry.counter("repowarden.dispatch.actions",
                    "action", "add_label", "status", "applied").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("repowarden.dispatch.actions",
                    "action", "post_comment", "status", "applied").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a permanently failing label does not stop the comment")
        void failureIsolation() {
            platform.failItem("bad label", new PermanentPlatformException("Validation Failed", 422, null));
            ActionPlan plan = ActionPlan.builder().addLabel("bad label").comment("still posted").build();

            DispatchOutcome outcome = dispatcher.dispatch(plan, ISSUE);

            assertThat(outcome.forAction(ActionType.ADD_LABEL)).singleElement()
                    .extracting(ActionOutcome::status).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.forAction(ActionType.POST_COMMENT)).singleElement()
                    .extracting(ActionOutcome::status).isEqualTo(OutcomeStatus.APPLIED);
            assertThat(outcome.hasFailures()).isTrue();
        }

        @Test
        @DisplayName("transient item failures are retried without resending settled items")
        void transientRetried() {
            platform.failItem("flaky", new TransientPlatformException("rate limited"));
            ActionPlan plan = ActionPlan.builder().addLabel("flaky").addLabel("steady").build();

            DispatchOutcome outcome = dispatcher.dispatch(plan, ISSUE);

            assertThat(outcome.count(OutcomeStatus.APPLIED)).isEqualTo(2);
            assertThat(platform.labels).containsExactly("flaky", "steady");
            assertThat(platform.writeCalls).isEqualTo(2);
        }

        @Test
        @DisplayName("transient failures that outlast the retry budget end as FAILED")
        void retryExhausted() {
            platform.failItem("flaky",
                    new TransientPlatformException("503"),
                    new TransientPlatformException("503"),
                    new TransientPlatformException("503"));
            ActionPlan plan = ActionPlan.builder().addLabel("flaky").build();

            DispatchOutcome outcome = dispatcher.dispatch(plan, ISSUE);

            assertThat(outcome.forAction(ActionType.ADD_LABEL)).singleElement()
                    .extracting(ActionOutcome::status).isEqualTo(OutcomeStatus.FAILED);
            assertThat(platform.labels).isEmpty();
        }

        @Test
        @DisplayName("a permanent comment failure is not retried")
        void permanentNotRetried() {
            platform.failComment(new PermanentPlatformException("Forbidden", 403, null));
            ActionPlan plan = ActionPlan.builder().comment("nope").build();

            DispatchOutcome outcome = dispatcher.dispatch(plan, ISSUE);

            assertThat(outcome.forAction(ActionType.POST_COMMENT)).singleElement()
                    .satisfies(a -> {
                        assertThat(a.status()).isEqualTo(OutcomeStatus.FAILED);
                        assertThat(a.detail()).isEqualTo("Forbidden");
                    });
            assertThat(platform.commentPosts).isZero();
        }

        @Test
        @DisplayName("a transient comment failure is retried")
        void transientCommentRetried() {
            platform.failComment(new TransientPlatformException("502"));

            DispatchOutcome outcome = dispatcher.dispatch(ActionPlan.builder().comment("retry me").build(), ISSUE);

            assertThat(outcome.count(OutcomeStatus.APPLIED)).isEqualTo(1);
            assertThat(platform.commentPosts).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("open circuit and rate limiter rejections count as transient")
    void transientClassification() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("github-api");
        breaker.transitionToOpenState();

        assertThat(ActionDispatcher.isTransient(CallNotPermittedException.createCallNotPermittedException(breaker)))
                .isTrue();
        assertThat(ActionDispatcher.isTransient(new TransientPlatformException("x"))).isTrue();
        assertThat(ActionDispatcher.isTransient(new PermanentPlatformException("x"))).isFalse();
        assertThat(ActionDispatcher.isTransient(new IllegalStateException("x"))).isFalse();
    }
}
