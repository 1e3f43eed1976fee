package com.clinicalguard.rules.expression;

import java.util.List;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Short-circuit {@code and} / {@code or} over truthiness of the operands.
 */
@Getter
@EqualsAndHashCode
public final class BooleanCombination implements Expression {

    private final BooleanOperator operator;
    private final List<Expression> operands;

    public BooleanCombination(BooleanOperator operator, List<Expression> operands) {
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    @Override
    public Object evaluate(FactContext facts) {
        boolean isAnd = operator == BooleanOperator.AND;
        for (Expression operand : operands) {
            boolean truthy = Values.isTruthy(operand.evaluate(facts));
            if (isAnd && !truthy) {
                return Boolean.FALSE;
            }
            if (!isAnd && truthy) {
                return Boolean.TRUE;
            }
        }
        return isAnd;
    }

    @Override
    public String toString() {
        return operator.name().toLowerCase() + operands;
    }
}
