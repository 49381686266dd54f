package com.terralint.core.rule;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;

import java.util.Objects;

/**
 * Registered metadata of one rule.
 *
 * @param id rule id
 * @param displayName human-readable name
 * @param category rule category
 * @param severity severity of the rule's violations
 * @param rule implementation
 */
public record RuleDescriptor(
    String id,
    String displayName,
    RuleCategory category,
    Severity severity,
    LintRule rule
) {
    /**
     * Compact constructor with validation.
     */
    public RuleDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
    }

    /**
     * Creates a descriptor from a rule's own metadata.
     *
     * @param rule rule implementation
     * @return descriptor
     */
    public static RuleDescriptor of(LintRule rule) {
        return new RuleDescriptor(rule.getId(), rule.getDisplayName(), rule.getCategory(), rule.getSeverity(), rule);
    }

    public boolean isDirectoryRule() {
        return rule instanceof DirectoryRule;
    }
}
