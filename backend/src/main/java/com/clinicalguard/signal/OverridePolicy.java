package com.clinicalguard.signal;

/**
 * What a clinician needs in order to proceed against a signal, declared from
 * least to most restrictive.
 */
public enum OverridePolicy {
    NONE,
    REQUIRES_JUSTIFICATION,
    REQUIRES_SUPERVISOR,
    BLOCKED;

    public OverridePolicy strictest(OverridePolicy other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }

    public boolean isOverridable() {
        return this != BLOCKED;
    }
}
