package com.terralint.core.rule.base;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.FileRule;
import com.terralint.core.util.FileUtils;

import java.util.List;
import java.util.stream.Stream;

/**
 * Base class for rules that check one file against its block tree.
 *
 * @since 1.0.0
 */
public abstract class AbstractFileRule extends AbstractRule implements FileRule {

    protected AbstractFileRule() {
        super();
    }

    // ==================== appliesTo() Helpers ====================

    /**
     * Returns true for {@code .tf} files.
     *
     * @param context file context
     * @return true for configuration files
     */
    protected boolean isConfigurationFile(FileContext context) {
        return FileUtils.isConfigurationFile(context.path());
    }

    // ==================== Block Tree Helpers ====================

    /**
     * Returns the top-level blocks of one kind.
     *
     * @param context file context
     * @param kind block kind
     * @return blocks in source order
     */
    protected List<Block> topLevel(FileContext context, BlockKind kind) {
        return context.root().children(kind);
    }

    /**
     * Streams every block of the file except the synthetic root, depth first.
     *
     * @param context file context
     * @return all blocks
     */
    protected Stream<Block> allBlocks(FileContext context) {
        return context.root().descendantsAndSelf().filter(b -> b.kind() != BlockKind.ROOT);
    }

    /**
     * Streams the code lines of the file (comment-only, blank and heredoc lines excluded).
     *
     * @param context file context
     * @return code lines
     */
    protected Stream<LineInfo> codeLines(FileContext context) {
        return context.lines().stream().filter(LineInfo::isCode);
    }
}
