package com.clinicalguard.validation;

import java.util.List;

import com.clinicalguard.knowledge.Concept;

import lombok.Value;

/**
 * Outcome of checking one prescription.
 *
 * {@code confidence} is identification confidence only: 100 once the drug text
 * resolved to a concept, 0 otherwise. It says nothing about safety.
 */
@Value
public class PrescriptionValidation {
    boolean valid;
    int confidence;
    Concept concept;
    boolean fuzzyMatch;
    List<ValidationIssue> issues;

    public boolean isResolved() {
        return concept != null;
    }
}
