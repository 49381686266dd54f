package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Label;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;

/**
 * ST.010: block labels are written as double-quoted strings.
 *
 * <p>{@code resource aws_vpc main} is accepted by older Terraform versions but is not the
 * canonical form.</p>
 *
 * @since 1.0.0
 */
public class QuoteUsageRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.010";
    private static final String DISPLAY_NAME = "Label quoting";

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
        return Severity.ERROR;
    }

    @Override
    public boolean appliesTo(FileContext context) {
        return isConfigurationFile(context);
    }

    @Override
    public void check(FileContext context, ViolationSink sink) {
        allBlocks(context)
            .filter(block -> block.labels().stream().anyMatch(label -> !label.quoted()))
            .forEach(block -> sink.report(context.path(), block.startLine(), message(block)));
    }

    private static String message(Block block) {
        return switch (block.kind()) {
            case RESOURCE -> "Resource type and name must be enclosed in double quotes";
            case DATA -> "Data source type and name must be enclosed in double quotes";
            case VARIABLE -> "Variable name must be enclosed in double quotes";
            case OUTPUT -> "Output name must be enclosed in double quotes";
            default -> {
                String unquoted = block.labels().stream()
                    .filter(label -> !label.quoted())
                    .map(Label::value)
                    .findFirst()
                    .orElse("");
                String keyword = block.kind() == BlockKind.DYNAMIC ? "Dynamic block" : capitalize(block.keyword());
                yield keyword + " label '" + unquoted + "' must be enclosed in double quotes";
            }
        };
    }

    private static String capitalize(String keyword) {
        return keyword.isEmpty() ? keyword : Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
    }
}
