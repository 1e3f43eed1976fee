package com.clinicalguard.rules.expression;

/**
 * Rule logic that does not parse into a supported expression tree.
 * A configuration-data defect, never a runtime fault.
 */
public class MalformedRuleException extends RuntimeException {

    public MalformedRuleException(String message) {
        super(message);
    }

    public MalformedRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
