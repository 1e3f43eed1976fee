package com.clinicalguard.validation;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Structured context captured next to a prescription, on top of free text.
 */
@Value
@Builder
public class PrescriptionContext {

    private static final PrescriptionContext EMPTY = PrescriptionContext.builder().build();

    @Singular("diagnosisId")
    List<String> diagnosisIds;
    @Singular
    List<String> currentMedications;
    @Singular
    List<String> allergies;

    public static PrescriptionContext empty() {
        return EMPTY;
    }
}
