package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.CheckState;

/**
 * Commit status to publish on the pull request head.
 */
public record StatusCheck(String context, CheckState state, String description) {
    public StatusCheck {
        if (context == null || context.isBlank()) throw new IllegalArgumentException("context required");
        if (state == null) throw new IllegalArgumentException("state required");
    }
}
