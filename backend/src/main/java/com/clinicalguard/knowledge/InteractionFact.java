package com.clinicalguard.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Two drugs that carry elevated risk together. The pair is unordered.
 */
@Value
@Builder
public class InteractionFact {
    String drugIdA;
    String drugIdB;
    Severity severity;
    String description;
    String source;
}
