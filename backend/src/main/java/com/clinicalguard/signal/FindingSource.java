package com.clinicalguard.signal;

public enum FindingSource {
    INTERACTION,
    CONTRAINDICATION,
    ALLERGY,
    DUPLICATE_THERAPY,
    RULE
}
