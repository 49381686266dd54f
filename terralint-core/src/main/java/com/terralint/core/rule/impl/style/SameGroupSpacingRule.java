package com.terralint.core.rule.impl.style;

import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.rule.base.BlockMember;
import com.terralint.core.rule.base.Layout;

import java.util.List;

/**
 * ST.007: siblings of the same group are separated by at most one blank line.
 *
 * <p>Two members form a group when they have the same kind: two basic parameters, two
 * meta-arguments, two collection parameters, or nested blocks of the same name. Top-level
 * blocks are left to ST.006; top-level assignments of a variable values file are checked.</p>
 *
 * @see BlockMember#sameGroupAs(BlockMember)
 * @since 1.0.0
 */
public class SameGroupSpacingRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.007";
    private static final String DISPLAY_NAME = "Same parameter block spacing";

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
        context.root().descendantsAndSelf().forEach(block -> {
            List<BlockMember> members = BlockMember.of(block);
            if (block.kind() == BlockKind.ROOT) {
                members = members.stream().filter(m -> !m.kind().isBlock()).toList();
            }
            for (int i = 1; i < members.size(); i++) {
                BlockMember previous = members.get(i - 1);
                BlockMember next = members.get(i);
                if (!previous.sameGroupAs(next)) {
                    continue;
                }
                int blanks = Layout.blankLinesBetween(context.file(), previous.endLine(), next.startLine());
                if (blanks > 1) {
                    sink.report(context.path(), next.startLine(),
                        "Found " + blanks + " blank lines between " + previous.kind().description() + " '"
                            + previous.name() + "' and " + next.kind().description() + " '" + next.name()
                            + "'. 0 or 1 blank line is recommended.");
                }
            }
        });
    }
}
