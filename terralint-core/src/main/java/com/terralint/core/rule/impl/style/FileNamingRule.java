package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;

import java.util.regex.Pattern;

/**
 * ST.014: file names (without the extension) use letters, digits and single underscores,
 * and start and end with a letter.
 *
 * <p>{@code *.auto.tfvars} files follow Terraform's own naming and are skipped. The
 * violation carries no line.</p>
 *
 * @since 1.0.0
 */
public class FileNamingRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.014";
    private static final String DISPLAY_NAME = "File naming";

    private static final Pattern VALID_STEM = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*[a-zA-Z]$");

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
        return RuleCategory.ST;
    }

    @Override
    public Severity getSeverity() {
        return Severity.WARNING;
    }

    @Override
    public boolean requiresStructure() {
        return false;
    }

    @Override
    public boolean appliesTo(FileContext context) {
        return !context.fileName().endsWith(".auto.tfvars");
    }

    @Override
    public void check(FileContext context, ViolationSink sink) {
        String fileName = context.fileName();
        int lastDot = fileName.lastIndexOf('.');
        String stem = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        if (!VALID_STEM.matcher(stem).matches() || stem.contains("__")) {
            sink.report(context.path(), 0,
                "File name '" + fileName + "' does not follow naming convention. Must contain only letters, "
                    + "numbers, and underscores, and start/end with a letter.");
        }
    }
}
