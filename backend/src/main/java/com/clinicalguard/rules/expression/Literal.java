package com.clinicalguard.rules.expression;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
public final class Literal implements Expression {

    private final Object value;

    public Literal(Object value) {
        this.value = value;
    }

    @Override
    public Object evaluate(FactContext facts) {
        return value;
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
