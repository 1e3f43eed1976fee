package com.clinicalguard.rules;

import com.clinicalguard.knowledge.Severity;

import lombok.Builder;
import lombok.Value;

/**
 * A rule that fired with a tag other than the no-op tag.
 */
@Value
@Builder
public class RuleOutcome {
    String ruleId;
    String ruleName;
    String category;
    String outcomeTag;
    Severity severity;
    String message;
    int priority;
    int version;
}
