package com.clinicalguard.rules;

import com.clinicalguard.rules.expression.Expression;

import lombok.Value;

@Value
public class CompiledRule {
    RuleDefinition definition;
    Expression expression;

    public String getRuleId() {
        return definition.getRuleId();
    }

    public int getPriority() {
        return definition.getPriority();
    }
}
