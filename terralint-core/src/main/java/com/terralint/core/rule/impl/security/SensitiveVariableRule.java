package com.terralint.core.rule.impl.security;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.rule.base.TerraformPatterns;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SC.005: variables that carry personal data or credentials are declared sensitive.
 *
 * <p>A variable is considered sensitive when its name is exactly one of {@code email},
 * {@code age}, {@code access_key}, {@code secret_key}, {@code sex} or {@code signature}, or
 * contains {@code phone}, {@code password} or {@code pwd} (case-insensitive). Such a
 * variable must set {@code sensitive = true}.</p>
 *
 * @since 1.0.0
 */
public class SensitiveVariableRule extends AbstractFileRule {

    private static final Set<String> EXACT_NAMES =
        Set.of("email", "age", "access_key", "secret_key", "sex", "signature");

    private static final List<String> NAME_FRAGMENTS = List.of("phone", "password", "pwd");

    public static final String RULE_ID = "SC.005";
    private static final String DISPLAY_NAME = "Sensitive variable declaration";

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
        return RuleCategory.SC;
    }

    @Override
    public Severity getSeverity() {
        return Severity.ERROR;
    }

    @Override
    public void check(FileContext context, ViolationSink sink) {
        for (Block variable : topLevel(context, BlockKind.VARIABLE)) {
            String name = variable.nameLabel().orElse("");
            if (!isSensitiveName(name)) {
                continue;
            }
            boolean declared = variable.parameter("sensitive")
                .map(p -> TerraformPatterns.isTrueLiteral(p.value()))
                .orElse(false);
            if (!declared) {
                sink.report(context.path(), variable.startLine(),
                    "Sensitive variable '" + name + "' must be declared with 'sensitive = true' to prevent data "
                        + "exposure in Terraform state and logs.");
            }
        }
    }

    static boolean isSensitiveName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return EXACT_NAMES.contains(lower) || NAME_FRAGMENTS.stream().anyMatch(lower::contains);
    }
}
