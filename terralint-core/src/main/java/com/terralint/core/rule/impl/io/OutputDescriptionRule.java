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
 * IO.007: every output carries a non-empty {@code description}.
 *
 * @see VariableDescriptionRule
 * @since 1.0.0
 */
public class OutputDescriptionRule extends AbstractFileRule {

    public static final String RULE_ID = "IO.007";
    private static final String DISPLAY_NAME = "Output description";

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
        for (Block output : topLevel(context, BlockKind.OUTPUT)) {
            String name = output.nameLabel().orElse("");
            Optional<Parameter> description = output.parameter("description");
            if (description.isEmpty()) {
                sink.report(context.path(), output.startLine(),
                    "Output '" + name + "' must include a description field");
            } else if (description.get().unquotedValue().isBlank()) {
                sink.report(context.path(), description.get().line(),
                    "Output '" + name + "' has an empty description field");
            }
        }
    }
}
