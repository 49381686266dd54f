package com.terralint.core.rule.impl.io;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;

import java.util.Optional;

/**
 * IO.006: every variable carries a non-empty {@code description}.
 *
 * @since 1.0.0
 */
public class VariableDescriptionRule extends AbstractFileRule {

    public static final String RULE_ID = "IO.006";
    private static final String DISPLAY_NAME = "Variable description";

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
            String name = variable.nameLabel().orElse("");
            Optional<Parameter> description = variable.parameter("description");
            if (description.isEmpty()) {
                sink.report(context.path(), variable.startLine(),
                    "Variable '" + name + "' must include a description field");
            } else if (description.get().unquotedValue().isBlank()) {
                sink.report(context.path(), description.get().line(),
                    "Variable '" + name + "' has an empty description field");
            }
        }
    }
}
