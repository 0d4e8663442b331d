package dev.repowarden.planner;

import dev.repowarden.command.CommandParser;
import dev.repowarden.domain.enums.CheckState;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.CommandName;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.IssueState;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.valueobject.ActionPlan;
import dev.repowarden.domain.valueobject.Command;
import dev.repowarden.domain.valueobject.Finding;
import dev.repowarden.domain.valueobject.MergedPullRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ActionPlannerTest {

    private static final String REPO = "octocat/hello-world";
    private static final Set<ClassifierType> ALL_CLASSIFIERS = EnumSet.allOf(ClassifierType.class);

    private final ActionPlanner planner = new ActionPlanner();

    private static PlanningContext prContext(boolean firstTime, boolean welcomed) {
        return new PlanningContext(EventKind.PULL_REQUEST_OPENED, REPO, "newbie", ALL_CLASSIFIERS,
                firstTime, welcomed, 0L, List.of());
    }

    private static final Finding PYTHON = new Finding(FindingCategory.LANGUAGE, Severity.INFO, "python", "a.py");
    private static final Finding MEDIUM = new Finding(FindingCategory.SIZE, Severity.INFO, "medium", "75 lines");
    private static final Finding SECRET = new Finding(FindingCategory.SECURITY, Severity.CRITICAL,
            "hardcoded-credential", "config/settings.py:3");
    private static final Finding SQL = new Finding(FindingCategory.SECURITY, Severity.WARN,
            "sql-injection-risk", "db.py:10");
    private static final Finding OWNER = new Finding(FindingCategory.OWNERSHIP, Severity.INFO, "alice", "1 file(s)");

    @Nested
    @DisplayName("pull request findings")
    class PullRequestFindings {

        @Test
        @DisplayName("derived labels are added, reviewers requested, stale size and security labels removed")
        void labelsAndReviewers() {
            ActionPlan plan = planner.plan(List.of(PYTHON, MEDIUM, OWNER), null, prContext(false, false));

            assertThat(plan.labelsToAdd()).containsExactly("lang:python", "size:medium");
            assertThat(plan.reviewersToRequest()).containsExactly("alice");
            assertThat(plan.labelsToRemove())
                    .contains("size:small", "size:large", "size:xlarge", "security:hardcoded-credential")
                    .doesNotContain("size:medium");
        }

        @Test
        @DisplayName("no security findings gives a successful status and no comment")
        void cleanScan() {
            ActionPlan plan = planner.plan(List.of(PYTHON, MEDIUM), null, prContext(false, false));

            assertThat(plan.status()).hasValueSatisfying(s -> {
                assertThat(s.context()).isEqualTo("security-scan");
                assertThat(s.state()).isEqualTo(CheckState.SUCCESS);
                assertThat(s.description()).isEqualTo("No issues found");
            });
            assertThat(plan.comment()).isEmpty();
        }

        @Test
        @DisplayName("a critical finding fails the status and renders a report")
        void criticalFinding() {
            ActionPlan plan = planner.plan(List.of(SECRET, SQL, MEDIUM), null, prContext(false, false));

            assertThat(plan.status()).hasValueSatisfying(s -> {
                assertThat(s.state()).isEqualTo(CheckState.FAILURE);
                assertThat(s.description()).isEqualTo("2 issue(s) found");
            });
            assertThat(plan.labelsToAdd()).contains("security:hardcoded-credential", "security:sql-injection-risk");
            assertThat(plan.comment()).hasValueSatisfying(body -> {
                assertThat(body).contains("Security Scan Results");
                assertThat(body).contains("`config/settings.py` (line 3)");
                assertThat(body).contains("`db.py` (line 10)");
            });
        }

        @Test
        @DisplayName("warnings alone keep the status green")
        void warningsOnly() {
            ActionPlan plan = planner.plan(List.of(SQL), null, prContext(false, false));

            assertThat(plan.status()).map(s -> s.state()).contains(CheckState.SUCCESS);
            assertThat(plan.comment()).isPresent();
        }

        @Test
        @DisplayName("first-time contributor gets a welcome with a hidden marker, once")
        void welcome() {
            ActionPlan first = planner.plan(List.of(MEDIUM), null, prContext(true, false));
            ActionPlan again = planner.plan(List.of(MEDIUM), null, prContext(true, true));

            assertThat(first.comment()).hasValueSatisfying(body -> {
                assertThat(body).contains("Welcome @newbie");
                assertThat(body).contains("hello-world");
                assertThat(body).contains(CommentMarkers.WELCOME);
            });
            assertThat(again.comment()).isEmpty();
        }

        @Test
        @DisplayName("security status is left alone when scanning did not run")
        void scanningDisabled() {
            PlanningContext context = new PlanningContext(EventKind.PULL_REQUEST_UPDATED, REPO, "dev",
                    EnumSet.complementOf(EnumSet.of(ClassifierType.SECURITY)), false, false, 0L, List.of());

            ActionPlan plan = planner.plan(List.of(MEDIUM), null, context);

            assertThat(plan.status()).isEmpty();
            assertThat(plan.labelsToRemove()).noneMatch(l -> l.startsWith("security:"));
        }

        @Test
        @DisplayName("size labels are kept when the size classifier did not finish")
        void sizeNotClassified() {
            PlanningContext context = new PlanningContext(EventKind.PULL_REQUEST_UPDATED, REPO, "dev",
                    EnumSet.of(ClassifierType.LANGUAGE, ClassifierType.SECURITY), false, false, 0L, List.of());

            ActionPlan plan = planner.plan(List.of(PYTHON), null, context);

            assertThat(plan.labelsToRemove()).noneMatch(l -> l.startsWith("size:"));
            assertThat(plan.status()).isPresent();
        }

        @Test
        @DisplayName("analysis and requirements become comment sections in a fixed order")
        void analysisSections() {
            List<Finding> findings = List.of(PYTHON, SECRET,
                    new Finding(FindingCategory.SUMMARY, Severity.INFO, "complexity:medium", "6 file(s), 120 line(s) changed"),
                    new Finding(FindingCategory.SUMMARY, Severity.WARN, "breaking:a.py", "a.py:1"),
                    new Finding(FindingCategory.REQUIREMENT, Severity.WARN, "missing-tests", "a.py"),
                    new Finding(FindingCategory.REQUIREMENT, Severity.WARN, "large-file", "gen/b.py"),
                    new Finding(FindingCategory.REQUIREMENT, Severity.WARN, "large-file", "gen/a.py"));

            ActionPlan plan = planner.plan(findings, null, prContext(false, false));

            assertThat(plan.labelsToAdd()).containsExactly("lang:python", "security:hardcoded-credential");
            assertThat(plan.comment()).hasValueSatisfying(body -> {
                String[] sections = body.split(CommentMarkers.SECTION_SEPARATOR);
                assertThat(sections).hasSize(3);
                assertThat(sections[0]).startsWith("📊 **PR Analysis:**")
                        .contains("- **Complexity:** Medium (6 file(s), 120 line(s) changed)")
                        .contains("- ⚠️ **Potential breaking changes in:** `a.py`")
                        .contains("- **Languages:** python");
                assertThat(sections[1]).isEqualTo("""
                        🤖 **Automated PR Review:**

                        - ⚠️ Consider adding tests for your code changes
                        - 📏 Large files detected: gen/a.py, gen/b.py - consider splitting""");
                assertThat(sections[2]).startsWith("🔒 **Security Scan Results:**");
            });
        }

        @Test
        @DisplayName("plan is identical regardless of finding order")
        void orderIndependent() {
            List<Finding> findings = new ArrayList<>(List.of(PYTHON, MEDIUM, SECRET, SQL, OWNER));
            ActionPlan forward = planner.plan(findings, null, prContext(true, false));
            Collections.reverse(findings);
            ActionPlan backward = planner.plan(findings, null, prContext(true, false));

            assertThat(forward).isEqualTo(backward);
        }
    }

    @Nested
    @DisplayName("issues and merges")
    class IssuesAndMerges {

        @Test
        @DisplayName("issue triage only adds labels")
        void issueLabels() {
            PlanningContext context = PlanningContext.forIssue(EventKind.ISSUE_OPENED, REPO, "reporter");
            List<Finding> findings = List.of(
                    new Finding(FindingCategory.CLASSIFICATION, Severity.INFO, "bug", "keyword: crash"),
                    new Finding(FindingCategory.PRIORITY, Severity.CRITICAL, "urgent", "keyword: urgent"));

            ActionPlan plan = planner.plan(findings, null, context);

            assertThat(plan.labelsToAdd()).containsExactly("bug", "priority:urgent");
            assertThat(plan.labelsToRemove()).isEmpty();
            assertThat(plan.status()).isEmpty();
            assertThat(plan.comment()).isEmpty();
        }

        @Test
        @DisplayName("issue template suggestions are posted as a comment")
        void issueSuggestions() {
            PlanningContext context = PlanningContext.forIssue(EventKind.ISSUE_OPENED, REPO, "reporter");
            List<Finding> findings = List.of(
                    new Finding(FindingCategory.SUGGESTION, Severity.INFO, "reproduction-steps", "title mentions a bug"),
                    new Finding(FindingCategory.SUGGESTION, Severity.INFO, "more-details", "8 characters"));

            ActionPlan plan = planner.plan(findings, null, context);

            assertThat(plan.labelsToAdd()).isEmpty();
            assertThat(plan.comment()).contains("""
                    📝 **Suggestions to improve this issue:**

                    - Consider providing more details about the issue
                    - For bug reports, please include steps to reproduce""");
        }

        @Test
        @DisplayName("merged pull request thanks its author")
        void mergeThanks() {
            PlanningContext context = PlanningContext.forIssue(EventKind.PULL_REQUEST_MERGED, REPO, "contributor");

            ActionPlan plan = planner.plan(List.of(), null, context);

            assertThat(plan.comment()).hasValueSatisfying(body ->
                    assertThat(body).startsWith("🎉 Thanks @contributor! Your contribution has been merged."));
        }
    }

    @Nested
    @DisplayName("commands")
    class Commands {

        private final CommandParser parser = new CommandParser();

        private PlanningContext context(long commentId) {
            return PlanningContext.forCommand(EventKind.ISSUE_COMMENT_CREATED, REPO, "maintainer", commentId,
                    List.of(new MergedPullRequest(12, "Fix login", "carol", Instant.parse("2026-01-02T00:00:00Z")),
                            new MergedPullRequest(11, "Add docs", "dave", Instant.parse("2026-01-01T00:00:00Z"))));
        }

        private ActionPlan plan(String body, long commentId) {
            Command command = parser.parse(body, "maintainer").orElseThrow();
            return planner.plan(List.of(), command, context(commentId));
        }

        @Test
        @DisplayName("/help lists every command")
        void help() {
            ActionPlan plan = plan("/help", 1);

            assertThat(plan.comment()).hasValueSatisfying(body -> {
                for (CommandName name : CommandName.values()) {
                    assertThat(body).contains(name.usage());
                }
                assertThat(body).contains(CommentMarkers.replyTo(1));
            });
        }

        @Test
        @DisplayName("/assign adds the login without the @")
        void assign() {
            assertThat(plan("/assign @alice", 2).assigneesToAdd()).containsExactly("alice");
        }

        @Test
        @DisplayName("/label adds exactly that label and nothing else")
        void label() {
            ActionPlan plan = plan("/label needs-triage", 3);

            assertThat(plan.labelsToAdd()).containsExactly("needs-triage");
            assertThat(plan.comment()).isEmpty();
        }

        @Test
        @DisplayName("/close and /reopen set the state and say who did it")
        void closeReopen() {
            ActionPlan close = plan("/close", 4);
            ActionPlan reopen = plan("/reopen", 5);

            assertThat(close.targetState()).contains(IssueState.CLOSED);
            assertThat(close.comment()).hasValueSatisfying(b -> assertThat(b).startsWith("🔒 Closed by @maintainer"));
            assertThat(reopen.targetState()).contains(IssueState.OPEN);
        }

        @Test
        @DisplayName("/changelog lists the merged pull requests from the context")
        void changelog() {
            assertThat(plan("/changelog", 6).comment()).hasValueSatisfying(body -> assertThat(body)
                    .contains("# Recent Changes")
                    .contains("- Fix login (#12) by @carol")
                    .contains("- Add docs (#11) by @dave"));
        }

        @Test
        @DisplayName("/joke is deterministic per source comment")
        void jokeDeterministic() {
            assertThat(plan("/joke", 42)).isEqualTo(plan("/joke", 42));
            assertThat(plan("/joke", 0).comment()).hasValueSatisfying(body ->
                    assertThat(body).startsWith("😄 " + ResponseTemplates.JOKES.get(0)));
            assertThat(plan("/motivate", 7).comment()).hasValueSatisfying(body ->
                    assertThat(body).startsWith("💪 " + ResponseTemplates.QUOTES.get(1)));
        }

        @Test
        @DisplayName("same reply text to different comments stays distinct")
        void replyMarkerDistinguishes() {
            assertThat(plan("/help", 100).comment()).isNotEqualTo(plan("/help", 101).comment());
        }

        @Test
        @DisplayName("unknown commands and bad arguments get a hint")
        void hints() {
            ActionPlan unknown = planner.planHint(parser.parseDetailed("/deploy now", "x"), context(9));
            ActionPlan invalid = planner.planHint(parser.parseDetailed("/assign alice", "x"), context(10));

            assertThat(unknown.comment()).hasValueSatisfying(b -> assertThat(b).contains("Unknown command `/deploy`"));
            assertThat(invalid.comment()).hasValueSatisfying(b -> assertThat(b).contains("`/assign @user`"));
            assertThat(planner.planHint(parser.parseDetailed("hello", "x"), context(11)).isEmpty()).isTrue();
        }
    }
}
