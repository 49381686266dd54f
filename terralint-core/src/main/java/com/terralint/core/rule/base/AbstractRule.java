package com.terralint.core.rule.base;

import com.terralint.core.rule.LintRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all built-in rules.
 *
 * <p>Provides a logger named after the concrete rule class. Rules override the metadata
 * getters with constants declared in the rule itself.</p>
 *
 * @see AbstractFileRule
 * @see AbstractDirectoryRule
 * @since 1.0.0
 */
public abstract class AbstractRule implements LintRule {

    /**
     * Logger for this rule, named after the concrete class.
     */
    protected final Logger log;

    protected AbstractRule() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public String toString() {
        return getId() + " (" + getDisplayName() + ")";
    }
}
