package com.clinicalguard.rules.expression;

import java.util.Collection;

import com.clinicalguard.rules.FactContext;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * {@code in}: list membership, or substring containment when the haystack is a string.
 */
@Getter
@EqualsAndHashCode
public final class Membership implements Expression {

    private final Expression needle;
    private final Expression haystack;

    public Membership(Expression needle, Expression haystack) {
        this.needle = needle;
        this.haystack = haystack;
    }

    @Override
    public Object evaluate(FactContext facts) {
        Object item = needle.evaluate(facts);
        Object container = haystack.evaluate(facts);
        if (item == null || container == null) {
            return Boolean.FALSE;
        }
        if (container instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null && Values.looselyEqual(item, value)) {
                    return Boolean.TRUE;
                }
            }
            return Boolean.FALSE;
        }
        if (container instanceof String text) {
            return text.contains(Values.asText(item));
        }
        return Boolean.FALSE;
    }

    @Override
    public String toString() {
        return "(" + needle + " in " + haystack + ")";
    }
}
