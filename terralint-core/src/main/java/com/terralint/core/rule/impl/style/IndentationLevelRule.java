package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractLineRule;
import com.terralint.core.rule.base.Layout;

/**
 * ST.005: a code line at nesting level {@code d} is indented by {@code 2 * d} spaces.
 *
 * <p>The nesting level is counted from brackets, so it also holds for files whose block
 * structure could not be extracted. Lines indented with tabs belong to ST.004 and are
 * skipped here, as are heredoc lines and lines that continue an expression started on a
 * previous line.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * resource "huaweicloud_vpc" "test" {
 *   name = "vpc"
 *   tags = {
 *       owner = "team"     # ST.005: expected 4 spaces at nesting level 2, found 6
 *   }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class IndentationLevelRule extends AbstractLineRule {

    public static final String RULE_ID = "ST.005";
    private static final String DISPLAY_NAME = "Indentation level";

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
    public void check(FileContext context, ViolationSink sink) {
        for (LineInfo line : context.lines()) {
            if (Layout.hasTabInIndentation(line) || !Layout.isLevelChecked(line)) {
                continue;
            }
            int actual = Layout.leadingSpaces(line);
            int expected = Layout.expectedIndent(line);
            if (actual == expected) {
                continue;
            }
            if (actual % Layout.INDENT_WIDTH != 0) {
                sink.report(context.path(), line.number(),
                    "Indentation of " + actual + " spaces is not a multiple of " + Layout.INDENT_WIDTH
                        + " spaces (expected " + expected + ")");
            } else {
                sink.report(context.path(), line.number(),
                    "Incorrect indentation level: expected " + expected + " spaces at nesting level "
                        + line.indentLevel() + ", found " + actual + " spaces");
            }
        }
    }
}
