package com.clinicalguard.knowledge;

public enum ConceptKind {
    DRUG,
    DIAGNOSIS
}
