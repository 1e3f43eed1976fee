package com.clinicalguard.rules.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
public final class ArrayExpression implements Expression {

    private final List<Expression> elements;

    public ArrayExpression(List<Expression> elements) {
        this.elements = List.copyOf(elements);
    }

    @Override
    public Object evaluate(FactContext facts) {
        List<Object> values = new ArrayList<>(elements.size());
        for (Expression element : elements) {
            values.add(element.evaluate(facts));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
