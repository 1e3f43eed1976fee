package com.clinicalguard.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Drug is unsafe given the diagnosis. Directional: never read the other way round.
 */
@Value
@Builder
public class ContraindicationFact {
    String drugId;
    String diagnosisId;
    Severity severity;
    String reason;
}
