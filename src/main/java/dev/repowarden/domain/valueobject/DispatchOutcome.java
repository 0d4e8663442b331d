package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.ActionType;
import dev.repowarden.domain.enums.OutcomeStatus;

import java.util.List;

/**
 * Per-event report of everything the dispatcher attempted.
 * {@code skipReason} is set when the event produced no plan at all.
 */
public record DispatchOutcome(String deliveryId, List<ActionOutcome> actions, String skipReason) {

    public DispatchOutcome {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static DispatchOutcome skipped(String deliveryId, String reason) {
        return new DispatchOutcome(deliveryId, List.of(), reason);
    }

    public static DispatchOutcome of(String deliveryId, List<ActionOutcome> actions) {
        return new DispatchOutcome(deliveryId, actions, null);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public long count(OutcomeStatus status) {
        return actions.stream().filter(a -> a.status() == status).count();
    }

    public boolean hasFailures() {
        return count(OutcomeStatus.FAILED) > 0;
    }

    public List<ActionOutcome> forAction(ActionType type) {
        return actions.stream().filter(a -> a.action() == type).toList();
    }
}
