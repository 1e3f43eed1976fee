package com.clinicalguard.rules.expression;

import java.util.List;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * {@code if} with arguments {@code [cond, then, (cond, then)*, else?]}.
 * Without an else branch a miss yields undefined.
 */
@Getter
@EqualsAndHashCode
public final class Conditional implements Expression {

    private final List<Expression> arguments;

    public Conditional(List<Expression> arguments) {
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(FactContext facts) {
        int i = 0;
        for (; i + 1 < arguments.size(); i += 2) {
            if (Values.isTruthy(arguments.get(i).evaluate(facts))) {
                return arguments.get(i + 1).evaluate(facts);
            }
        }
        return i < arguments.size() ? arguments.get(i).evaluate(facts) : null;
    }

    @Override
    public String toString() {
        return "if" + arguments;
    }
}
