package com.terralint.core.rule.impl.io;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.rule.base.TerraformPatterns;

/**
 * IO.004: variable names are lowercase snake case and do not start with an underscore.
 *
 * @since 1.0.0
 */
public class VariableNamingRule extends AbstractFileRule {

    public static final String RULE_ID = "IO.004";
    private static final String DISPLAY_NAME = "Variable naming";

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
            String name = variable.nameLabel().orElse(null);
            if (name != null && !TerraformPatterns.SNAKE_CASE.matcher(name).matches()) {
                sink.report(context.path(), variable.startLine(),
                    "Variable '" + name + "' should use snake_case naming convention "
                        + "(lowercase letters and underscores only, not starting with underscore)");
            }
        }
    }
}
