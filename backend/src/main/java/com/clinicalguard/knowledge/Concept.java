package com.clinicalguard.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized clinical entity. Drugs and diagnoses share this shape and are
 * told apart by {@link #kind}.
 */
@Value
@Builder
public class Concept {
    String id;
    String displayName;
    ConceptKind kind;
    boolean active;

    public boolean isDrug() {
        return kind == ConceptKind.DRUG;
    }

    public boolean isDiagnosis() {
        return kind == ConceptKind.DIAGNOSIS;
    }
}
