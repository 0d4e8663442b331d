package dev.repowarden.platform;

import dev.repowarden.exception.PlatformException;

/**
 * Per-item result of a batched write (one label, one reviewer, one assignee).
 */
public record EffectResult(EffectStatus status, String message, boolean transientFailure) {

    public static EffectResult applied() {
        return new EffectResult(EffectStatus.APPLIED, null, false);
    }

    public static EffectResult unchanged(String reason) {
        return new EffectResult(EffectStatus.UNCHANGED, reason, false);
    }

    public static EffectResult failed(PlatformException e) {
        return new EffectResult(EffectStatus.FAILED, e.getMessage(), e.isTransient());
    }

    public boolean isTransientFailure() {
        return status == EffectStatus.FAILED && transientFailure;
    }
}
