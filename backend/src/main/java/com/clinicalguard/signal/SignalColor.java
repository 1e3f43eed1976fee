package com.clinicalguard.signal;

/**
 * Traffic-light color, declared from least to most severe.
 */
public enum SignalColor {
    GREEN,
    YELLOW,
    RED;

    public SignalColor worst(SignalColor other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }
}
