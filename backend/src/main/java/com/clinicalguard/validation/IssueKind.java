package com.clinicalguard.validation;

public enum IssueKind {
    INTERACTION,
    CONTRAINDICATION,
    ALLERGY,
    DUPLICATE_THERAPY
}
