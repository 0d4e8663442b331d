package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.ActionType;
import dev.repowarden.domain.enums.OutcomeStatus;

/**
 * Result of one dispatched action.
 *
 * @param subject the label, login, status context or comment digest the action was about
 * @param detail  skip reason or failure message; {@code null} when applied
 */
public record ActionOutcome(ActionType action, String subject, OutcomeStatus status, String detail) {

    public static ActionOutcome applied(ActionType action, String subject) {
        return new ActionOutcome(action, subject, OutcomeStatus.APPLIED, null);
    }

    public static ActionOutcome skipped(ActionType action, String subject, String reason) {
        return new ActionOutcome(action, subject, OutcomeStatus.SKIPPED, reason);
    }

    public static ActionOutcome failed(ActionType action, String subject, String error) {
        return new ActionOutcome(action, subject, OutcomeStatus.FAILED, error);
    }
}
