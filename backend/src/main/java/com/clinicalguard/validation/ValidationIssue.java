package com.clinicalguard.validation;

import java.util.List;

import com.clinicalguard.knowledge.Severity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Safety issue raised by the validator.
 *
 * {@code factBacked} is true when the severity comes from a curated knowledge
 * fact rather than from a keyword trigger's fallback.
 */
@Value
@Builder
public class ValidationIssue {
    String issueId;
    IssueKind kind;
    Severity severity;
    String message;
    @Singular
    List<String> evidenceConceptIds;
    boolean factBacked;

    public boolean isBlocking() {
        return factBacked && severity.isBlocking();
    }
}
