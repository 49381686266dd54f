package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.rule.base.BlockMember;
import com.terralint.core.rule.base.Layout;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * ST.008: siblings of different groups are separated by exactly one blank line.
 *
 * <p>Applies to the bodies of resource, data, provider, module, terraform and nested
 * blocks. The bodies of {@code variable}, {@code output} and {@code locals} blocks are
 * short declarations and are not checked, nor are the entries of object literals.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * resource "huaweicloud_compute_instance" "test" {
 *   count = 2
 *
 *   name = "ecs"
 *
 *   network {
 *     uuid = huaweicloud_vpc_subnet.test.id
 *   }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class DifferentGroupSpacingRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.008";
    private static final String DISPLAY_NAME = "Different parameter block spacing";

    private static final Set<BlockKind> EXEMPT = EnumSet.of(
        BlockKind.ROOT, BlockKind.VARIABLE, BlockKind.OUTPUT, BlockKind.LOCALS);

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
        context.root().descendantsAndSelf()
            .filter(block -> !EXEMPT.contains(block.kind()))
            .forEach(block -> checkBlock(context, block, sink));
    }

    private void checkBlock(FileContext context, Block block, ViolationSink sink) {
        List<BlockMember> members = BlockMember.of(block);
        for (int i = 1; i < members.size(); i++) {
            BlockMember previous = members.get(i - 1);
            BlockMember next = members.get(i);
            if (previous.sameGroupAs(next)) {
                continue;
            }
            int blanks = Layout.blankLinesBetween(context.file(), previous.endLine(), next.startLine());
            String pair = describePair(previous, next) + " '" + previous.name() + "' and '" + next.name() + "'";
            if (blanks == 0) {
                sink.report(context.path(), next.startLine(),
                    "Missing blank line between " + pair + " in " + block.describe() + " (1 blank line is expected)");
            } else if (blanks > 1) {
                sink.report(context.path(), next.startLine(),
                    "Found " + blanks + " blank lines between " + pair + " in " + block.describe()
                        + ". Use exactly one blank line between different parameter types");
            }
        }
    }

    private static String describePair(BlockMember previous, BlockMember next) {
        boolean previousBlock = previous.kind().isBlock();
        boolean nextBlock = next.kind().isBlock();
        if (previousBlock && nextBlock) {
            return "different-named parameter blocks";
        }
        if (nextBlock) {
            return "basic parameter and parameter block";
        }
        if (previousBlock) {
            return "parameter block and basic parameter";
        }
        return previous.kind().description() + " and " + next.kind().description();
    }
}
