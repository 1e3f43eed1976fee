package com.clinicalguard.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * A known-dangerous drug pair detectable from keyword co-occurrence: the
 * prescribed drug text carries {@code drugKeyword} while the surrounding
 * context carries {@code contextKeyword}.
 */
@Value
@Builder
public class PairTrigger {
    String triggerId;
    String drugKeyword;
    String contextKeyword;
    String primaryDrugId;
    String secondaryDrugId;
    Severity fallbackSeverity;
    String message;
}
