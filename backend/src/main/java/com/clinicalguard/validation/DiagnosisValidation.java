package com.clinicalguard.validation;

import com.clinicalguard.knowledge.Concept;

import lombok.Value;

@Value
public class DiagnosisValidation {
    boolean valid;
    int confidence;
    Concept concept;

    public static DiagnosisValidation resolved(Concept concept) {
        return new DiagnosisValidation(true, 100, concept);
    }

    public static DiagnosisValidation unresolved() {
        return new DiagnosisValidation(false, 0, null);
    }
}
