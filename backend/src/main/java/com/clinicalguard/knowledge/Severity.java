package com.clinicalguard.knowledge;

import com.clinicalguard.signal.SignalColor;

/**
 * Severity shared by interaction facts, contraindication facts, rules and issues.
 * Declared in ascending order of danger.
 */
public enum Severity {
    LOW,
    MODERATE,
    HIGH,
    CONTRAINDICATED;

    public SignalColor tier() {
        return switch (this) {
            case HIGH, CONTRAINDICATED -> SignalColor.RED;
            case MODERATE -> SignalColor.YELLOW;
            case LOW -> SignalColor.GREEN;
        };
    }

    /**
     * Severities that make a fact-backed finding non-overridable.
     */
    public boolean isBlocking() {
        return this == HIGH || this == CONTRAINDICATED;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
