package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.rule.base.Layout;

import java.util.List;

/**
 * ST.006: exactly one blank line between top-level blocks.
 *
 * <p>Comment lines between two blocks do not count as blank. A missing blank line is
 * reported at the start of the second block; surplus blank lines are reported at the first
 * blank line beyond the allowed one.</p>
 *
 * @since 1.0.0
 */
public class BlockSpacingRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.006";
    private static final String DISPLAY_NAME = "Top-level block spacing";

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
        List<Block> blocks = context.root().children();
        for (int i = 1; i < blocks.size(); i++) {
            Block previous = blocks.get(i - 1);
            Block next = blocks.get(i);
            int blanks = Layout.blankLinesBetween(context.file(), previous.endLine(), next.startLine());
            if (blanks == 0) {
                sink.report(context.path(), next.startLine(),
                    "Missing blank line between " + describe(previous) + " and " + describe(next)
                        + ", the number of blank line should be 1.");
            } else if (blanks > 1) {
                sink.report(context.path(), surplusBlankLine(context.file(), previous.endLine(), next.startLine()),
                    "Too many blank lines between " + describe(previous) + " and " + describe(next)
                        + ", the number of blank line should be 1.");
            }
        }
    }

    private static int surplusBlankLine(ParsedFile file, int after, int before) {
        int seen = 0;
        for (int number = after + 1; number < before; number++) {
            if (file.line(number).isBlank() && ++seen == 2) {
                return number;
            }
        }
        return before;
    }

    static String describe(Block block) {
        return switch (block.kind()) {
            case RESOURCE -> "resource '" + block.typeLabel().orElse("") + "'";
            case DATA -> "data source '" + block.typeLabel().orElse("") + "'";
            case VARIABLE -> "variable '" + block.nameLabel().orElse("") + "'";
            case OUTPUT -> "output '" + block.nameLabel().orElse("") + "'";
            case LOCALS -> "locals";
            default -> block.nameLabel()
                .map(name -> block.keyword() + " '" + name + "'")
                .orElse(block.keyword());
        };
    }
}
