package com.terralint.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Rule families. The two-letter code is the prefix of every rule id in the family
 * (e.g. {@code ST.003}).
 *
 * @since 1.0.0
 */
public enum RuleCategory {
    /**
     * Style and formatting: naming, alignment, indentation, spacing, quoting, whitespace.
     */
    ST("Style/Format"),

    /**
     * Input/output organization: where variables and outputs live and how they are declared.
     */
    IO("Input/Output"),

    /**
     * Documentation and comment formatting.
     */
    DC("Documentation/Comments"),

    /**
     * Safety patterns: unsafe indexing, sensitive values, version constraints.
     */
    SC("Security Code");

    private final String displayName;

    RuleCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a category by its code, ignoring case and surrounding whitespace.
     *
     * @param code category code such as "st" or "SC"
     * @return the category, or empty if the code is unknown
     */
    public static Optional<RuleCategory> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (RuleCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Derives the category from a rule id prefix ({@code "IO.003"} to {@link #IO}).
     *
     * @param ruleId rule id
     * @return the category, or empty if the prefix is unknown
     */
    public static Optional<RuleCategory> ofRuleId(String ruleId) {
        int dot = ruleId == null ? -1 : ruleId.indexOf('.');
        return dot < 0 ? Optional.empty() : fromCode(ruleId.substring(0, dot));
    }
}
