package com.clinicalguard.rules.expression;

import java.math.BigDecimal;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Binary comparison. Undefined or non-comparable operands make it false.
 */
@Getter
@EqualsAndHashCode
public final class Comparison implements Expression {

    private final ComparisonOperator operator;
    private final Expression left;
    private final Expression right;

    public Comparison(ComparisonOperator operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(FactContext facts) {
        Object a = left.evaluate(facts);
        Object b = right.evaluate(facts);
        if (a == null || b == null) {
            return Boolean.FALSE;
        }
        if (operator == ComparisonOperator.EQUAL) {
            return Values.looselyEqual(a, b);
        }
        BigDecimal x = Values.toNumber(a);
        BigDecimal y = Values.toNumber(b);
        if (x != null && y != null) {
            return test(x.compareTo(y));
        }
        if (a instanceof String s && b instanceof String t) {
            return test(s.compareTo(t));
        }
        return Boolean.FALSE;
    }

    private Boolean test(int cmp) {
        return switch (operator) {
            case GREATER_THAN -> cmp > 0;
            case LESS_THAN -> cmp < 0;
            case GREATER_OR_EQUAL -> cmp >= 0;
            case LESS_OR_EQUAL -> cmp <= 0;
            case EQUAL -> cmp == 0;
        };
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
