package com.terralint.core.rule.impl.io;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

/**
 * IO.009: every variable is referenced somewhere in its directory.
 *
 * <p>References are {@code var.NAME} tokens in code and heredoc text of any file of the
 * directory. A reference from inside the variable's own block (for example in its
 * validation condition) does not count. Allow-listed variables are exempt.</p>
 *
 * @since 1.0.0
 */
public class UnusedVariableRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "IO.009";
    private static final String DISPLAY_NAME = "Unused variable";

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public RuleCategory getCategory() {
        return RuleCategory.IO;
    }

    @Override
    public Severity getSeverity() {
        return Severity.WARNING;
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        DirectoryIndex index = context.index();
        for (DirectoryIndex.Definition definition : index.variables()) {
            if (context.settings().isAllowListed(definition.name())) {
                continue;
            }
            if (index.usages(definition.name()).isEmpty()) {
                sink.report(definition.file(), definition.line(),
                    "Variable '" + definition.name() + "' is defined but never used");
            }
        }
    }
}
