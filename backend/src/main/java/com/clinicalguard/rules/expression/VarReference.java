package com.clinicalguard.rules.expression;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Named fact lookup, with an optional fallback used when the fact is absent.
 */
@Getter
@EqualsAndHashCode
public final class VarReference implements Expression {

    private final String path;
    private final Expression fallback;

    public VarReference(String path, Expression fallback) {
        this.path = path;
        this.fallback = fallback;
    }

    @Override
    public Object evaluate(FactContext facts) {
        Object value = facts.lookup(path);
        if (value == null && fallback != null) {
            return fallback.evaluate(facts);
        }
        return value;
    }

    @Override
    public String toString() {
        return "var(" + path + ")";
    }
}
