package dev.repowarden.router;

import dev.repowarden.command.CommandParseResult;
import dev.repowarden.domain.valueobject.Finding;
import dev.repowarden.planner.PlanningContext;
import dev.repowarden.platform.PlatformTarget;

import java.util.List;

/**
 * What the router decided to do with an event.
 */
public sealed interface RouterResult {

    record Skipped(String reason) implements RouterResult {}

    record Classified(List<Finding> findings, PlanningContext context, PlatformTarget target) implements RouterResult {
        public Classified {
            findings = List.copyOf(findings);
        }
    }

    /** A slash line addressed to the bot, recognized or not. */
    record Commanded(CommandParseResult parse, PlanningContext context, PlatformTarget target) implements RouterResult {}
}
