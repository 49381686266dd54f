package com.terralint.core.rule.impl.io;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;

/**
 * IO.008: every variable declares a {@code type}.
 *
 * @since 1.0.0
 */
public class VariableTypeRule extends AbstractFileRule {

    public static final String RULE_ID = "IO.008";
    private static final String DISPLAY_NAME = "Variable type";

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
    public void check(FileContext context, ViolationSink sink) {
        for (Block variable : topLevel(context, BlockKind.VARIABLE)) {
            if (!variable.hasParameter("type")) {
                sink.report(context.path(), variable.startLine(),
                    "Variable '" + variable.nameLabel().orElse("") + "' must include a type field");
            }
        }
    }
}
