package dev.repowarden.platform;

/**
 * What a write call did on the platform. UNCHANGED means the desired state was already in place.
 */
public enum EffectStatus {
    APPLIED, UNCHANGED, FAILED
}
