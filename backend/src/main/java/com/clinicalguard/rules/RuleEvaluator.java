package com.clinicalguard.rules;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates a compiled rule set against a fact context.
 *
 * Pure: the same rule set and facts always give the same outcomes. A rule that
 * fails at runtime is logged and skipped; later rules still run.
 */
@Component
@Slf4j
public class RuleEvaluator {

    public static final String NO_OP_TAG = "CONTINUE";

    public List<RuleOutcome> evaluate(RuleSet ruleSet, FactContext facts) {
        List<RuleOutcome> outcomes = new ArrayList<>();
        if (ruleSet == null) {
            return outcomes;
        }
        FactContext context = facts != null ? facts : FactContext.empty();

        for (CompiledRule rule : ruleSet.getRules()) {
            Object result;
            try {
                result = rule.getExpression().evaluate(context);
            } catch (RuntimeException e) {
                log.error("Rule {} failed during evaluation and was skipped: {}", rule.getRuleId(), e.getMessage());
                continue;
            }
            if (!(result instanceof String tag) || tag.isBlank() || NO_OP_TAG.equals(tag)) {
                continue;
            }
            RuleDefinition definition = rule.getDefinition();
            outcomes.add(RuleOutcome.builder()
                .ruleId(definition.getRuleId())
                .ruleName(definition.getName())
                .category(definition.getCategory())
                .outcomeTag(tag)
                .severity(definition.getSeverity())
                .message(definition.getMessage() != null ? definition.getMessage() : tag)
                .priority(definition.getPriority())
                .version(definition.getVersion())
                .build());
            log.debug("Rule {} fired: {}", definition.getRuleId(), tag);
        }
        return outcomes;
    }
}
