package com.clinicalguard.rules.expression;

public enum BooleanOperator {
    AND,
    OR
}
