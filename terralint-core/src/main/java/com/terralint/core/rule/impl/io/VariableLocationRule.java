package com.terralint.core.rule.impl.io;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

/**
 * IO.001: variables are defined in the variables file of their directory.
 *
 * <p>Each {@code variable} block found in any other file is reported at its own line. The
 * canonical file name is {@code files.variables}, {@code variables.tf} by default.</p>
 *
 * @since 1.0.0
 */
public class VariableLocationRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "IO.001";
    private static final String DISPLAY_NAME = "Variable definition location";

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
        String expected = context.settings().files().variables();
        for (DirectoryIndex.Definition definition : context.index().variables()) {
            String fileName = definition.file().getFileName().toString();
            if (!fileName.equals(expected)) {
                sink.report(definition.file(), definition.line(),
                    "Variable '" + definition.name() + "' should be defined in " + expected + ", not in " + fileName);
            }
        }
    }
}
