package com.clinicalguard.signal;

import java.util.List;

import lombok.Value;

/**
 * Single color-graded result of one evaluation. A GREEN signal with no findings
 * means no issue was detected by the current knowledge and rules, not that the
 * action is verified safe.
 */
@Value
public class DecisionSignal {
    SignalColor color;
    List<Finding> findings;
    OverridePolicy overridePolicy;

    public DecisionSignal(SignalColor color, List<Finding> findings, OverridePolicy overridePolicy) {
        this.color = color;
        this.findings = List.copyOf(findings);
        this.overridePolicy = overridePolicy;
    }

    public static DecisionSignal green() {
        return new DecisionSignal(SignalColor.GREEN, List.of(), OverridePolicy.NONE);
    }
}
