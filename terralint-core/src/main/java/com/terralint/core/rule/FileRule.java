package com.terralint.core.rule;

/**
 * A rule that checks one file in isolation.
 */
public interface FileRule extends LintRule {

    /**
     * Whether the rule applies to this file at all, e.g. only to {@code .tf} files.
     *
     * @param context the parsed file and rule settings
     * @return true if {@link #check} should run
     */
    default boolean appliesTo(FileContext context) {
        return true;
    }

    /**
     * Checks one file.
     *
     * @param context the parsed file and rule settings
     * @param sink where violations are reported
     */
    void check(FileContext context, ViolationSink sink);
}
