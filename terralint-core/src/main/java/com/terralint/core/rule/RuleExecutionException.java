package com.terralint.core.rule;

/**
 * Wraps an unexpected failure of a rule while it checked a file or directory.
 *
 * <p>The engine catches it at the rule boundary and records a tool diagnostic; the run
 * goes on with the next rule.</p>
 */
public class RuleExecutionException extends RuntimeException {

    private final String ruleId;

    public RuleExecutionException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
