package com.terralint.core.rule;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;

/**
 * A lint rule. Implementations are {@link FileRule}s, which see one file at a time, or
 * {@link DirectoryRule}s, which see every file of a directory at once.
 *
 * <p>Rules must be stateless: the engine calls one instance from several threads.</p>
 *
 * @since 1.0.0
 */
public interface LintRule {

    /**
     * Unique rule id, e.g. {@code ST.003}.
     *
     * @return rule id
     */
    String getId();

    /**
     * Short human-readable name shown in reports and {@code list rules}.
     *
     * @return display name
     */
    String getDisplayName();

    RuleCategory getCategory();

    Severity getSeverity();

    /**
     * Whether the rule reads the block tree. Such rules are skipped for files whose
     * structure could not be extracted.
     *
     * @return true if the rule needs a trustworthy block tree
     */
    default boolean requiresStructure() {
        return true;
    }
}
