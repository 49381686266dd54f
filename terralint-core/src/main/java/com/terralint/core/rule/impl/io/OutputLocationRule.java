package com.terralint.core.rule.impl.io;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

/**
 * IO.002: outputs are defined in the outputs file of their directory.
 *
 * @see VariableLocationRule
 * @since 1.0.0
 */
public class OutputLocationRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "IO.002";
    private static final String DISPLAY_NAME = "Output definition location";

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
        return Severity.ERROR;
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        String expected = context.settings().files().outputs();
        for (DirectoryIndex.Definition definition : context.index().outputs()) {
            String fileName = definition.file().getFileName().toString();
            if (!fileName.equals(expected)) {
                sink.report(definition.file(), definition.line(),
                    "Output '" + definition.name() + "' should be defined in " + expected + ", not in " + fileName);
            }
        }
    }
}
