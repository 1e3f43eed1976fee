package com.clinicalguard.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Active, compiled rules in evaluation order: priority descending, then rule id
 * ascending. Also remembers which rules were dropped as malformed.
 */
public final class RuleSet {

    public static final Comparator<CompiledRule> EVALUATION_ORDER =
        Comparator.comparingInt(CompiledRule::getPriority).reversed()
            .thenComparing(CompiledRule::getRuleId);

    private static final RuleSet EMPTY = new RuleSet(List.of(), Set.of());

    private final List<CompiledRule> rules;
    private final Set<String> skippedRuleIds;

    public RuleSet(Collection<CompiledRule> rules, Collection<String> skippedRuleIds) {
        List<CompiledRule> ordered = new ArrayList<>(rules);
        ordered.sort(EVALUATION_ORDER);
        this.rules = List.copyOf(ordered);
        this.skippedRuleIds = Set.copyOf(new TreeSet<>(skippedRuleIds));
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    public List<CompiledRule> getRules() {
        return rules;
    }

    public Set<String> getSkippedRuleIds() {
        return skippedRuleIds;
    }

    public int size() {
        return rules.size();
    }
}
