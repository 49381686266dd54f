package com.terralint.core.rule;

/**
 * A rule that needs every file of a directory at once, such as placement, ordering and
 * usage checks on variables.
 *
 * <p>Runs once per directory after all files of the run have been extracted.</p>
 */
public interface DirectoryRule extends LintRule {

    /**
     * Whether the rule applies to this directory, e.g. only when a canonical file exists.
     *
     * @param context parsed files of the directory and their index
     * @return true if {@link #check} should run
     */
    default boolean appliesTo(DirectoryContext context) {
        return true;
    }

    /**
     * Checks one directory.
     *
     * @param context parsed files of the directory and their index
     * @param sink where violations are reported; violations may target any file of the directory
     */
    void check(DirectoryContext context, ViolationSink sink);
}
