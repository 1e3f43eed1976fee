package com.clinicalguard.rules;

import com.clinicalguard.knowledge.Severity;

import lombok.Builder;
import lombok.Value;

/**
 * Externally authored rule as read from the authoring store, before compilation.
 */
@Value
@Builder(toBuilder = true)
public class RuleDefinition {
    String ruleId;
    String name;
    String category;
    int priority;
    String logic;
    Severity severity;
    String message;
    boolean active;
    int version;
}
