package com.terralint.core.rule.impl.doc;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractLineRule;

/**
 * DC.001: a {@code #} comment starts with exactly one space.
 *
 * <p>Applies to full-line and trailing {@code #} comments. A bare {@code #} is accepted.
 * {@code //} and block comments are not checked, and neither is a {@code #} inside a string
 * literal or a heredoc body.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * # Creates the test VPC        ok
 * #Creates the test VPC         DC.001
 * #   Creates the test VPC      DC.001
 * }</pre>
 *
 * @since 1.0.0
 */
public class CommentFormatRule extends AbstractLineRule {

    public static final String RULE_ID = "DC.001";
    private static final String DISPLAY_NAME = "Comment format";

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
        return RuleCategory.DC;
    }

    @Override
    public Severity getSeverity() {
        return Severity.ERROR;
    }

    @Override
    public void check(FileContext context, ViolationSink sink) {
        for (LineInfo line : context.lines()) {
            if (line.isHeredoc() || !line.hasComment() || line.text().charAt(line.commentColumn()) != '#') {
                continue;
            }
            String body = line.text().substring(line.commentColumn() + 1);
            if (body.isEmpty()) {
                continue;
            }
            if (body.charAt(0) != ' ') {
                sink.report(context.path(), line.number(), "Comment should have one space after '#' character");
            } else if (body.startsWith("  ") || body.startsWith(" \t")) {
                sink.report(context.path(), line.number(),
                    "Comment should have exactly one space after '#' character");
            }
        }
    }
}
