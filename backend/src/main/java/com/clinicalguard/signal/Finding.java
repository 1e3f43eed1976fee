package com.clinicalguard.signal;

import com.clinicalguard.knowledge.Severity;

import lombok.Builder;
import lombok.Value;

/**
 * One line of a decision signal: a validator issue or a fired rule.
 * {@code sourceId} is the issue id or the rule id. {@code category} is the
 * summary bucket: the rule's category for rules, the source name for issues.
 */
@Value
@Builder
public class Finding {
    String sourceId;
    FindingSource source;
    String category;
    Severity severity;
    SignalColor color;
    String message;
    String outcomeTag;
    boolean blocking;
}
