package com.clinicalguard.rules.expression;

import com.clinicalguard.rules.FactContext;

/**
 * Node of a compiled rule expression tree. Evaluation has no side effects and
 * always terminates: the tree is finite and no node loops.
 *
 * A {@code null} result means undefined, which is how an absent fact surfaces.
 */
public interface Expression {

    Object evaluate(FactContext facts);
}
