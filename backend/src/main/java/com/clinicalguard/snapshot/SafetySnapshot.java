package com.clinicalguard.snapshot;

import java.time.Instant;

import com.clinicalguard.knowledge.KnowledgeBase;
import com.clinicalguard.rules.RuleSet;

import lombok.Value;

/**
 * Knowledge and rules loaded together. Evaluations hold one snapshot for their
 * whole duration, so a refresh is never observed half-applied.
 */
@Value
public class SafetySnapshot {
    long generation;
    Instant loadedAt;
    KnowledgeBase knowledge;
    RuleSet rules;
}
