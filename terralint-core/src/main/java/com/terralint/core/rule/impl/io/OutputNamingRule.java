package com.terralint.core.rule.impl.io;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;

import java.util.regex.Pattern;

/**
 * IO.005: output names start with a letter, contain only letters, digits and underscores,
 * have no consecutive underscores and do not end with a digit.
 *
 * <p>Unlike variables, outputs may use uppercase letters.</p>
 *
 * @since 1.0.0
 */
public class OutputNamingRule extends AbstractFileRule {

    public static final String RULE_ID = "IO.005";
    private static final String DISPLAY_NAME = "Output naming";

    private static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");

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
            String name = output.nameLabel().orElse(null);
            if (name != null && !isValid(name)) {
                sink.report(context.path(), output.startLine(),
                    "Output '" + name + "' should follow naming convention (letters, numbers, and underscores only; "
                        + "not starting/ending with underscore or number; no consecutive underscores)");
            }
        }
    }

    static boolean isValid(String name) {
        return VALID_NAME.matcher(name).matches()
            && !name.contains("__")
            && !Character.isDigit(name.charAt(name.length() - 1));
    }
}
