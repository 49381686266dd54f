package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractLineRule;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * ST.011: no whitespace at the end of a line. Heredoc bodies keep their content as written.
 *
 * @since 1.0.0
 */
public class TrailingWhitespaceRule extends AbstractLineRule {

    public static final String RULE_ID = "ST.011";
    private static final String DISPLAY_NAME = "Trailing whitespace";

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
    public void check(FileContext context, ViolationSink sink) {
        for (LineInfo line : context.lines()) {
            if (line.isHeredoc()) {
                continue;
            }
            String text = line.text();
            String stripped = text.stripTrailing();
            if (stripped.length() == text.length()) {
                continue;
            }
            Set<String> kinds = new LinkedHashSet<>();
            for (char c : text.substring(stripped.length()).toCharArray()) {
                kinds.add(describe(c));
            }
            sink.report(context.path(), line.number(),
                "Line contains trailing whitespace characters: " + String.join(", ", kinds));
        }
    }

    private static String describe(char c) {
        return switch (c) {
            case ' ' -> "space";
            case '\t' -> "tab";
            default -> "whitespace(" + (int) c + ")";
        };
    }
}
