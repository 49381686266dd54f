package com.terralint.core.rule.base;

import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryRule;
import com.terralint.core.util.FileUtils;

import java.util.List;

/**
 * Base class for rules that need every file of a directory.
 *
 * @since 1.0.0
 */
public abstract class AbstractDirectoryRule extends AbstractRule implements DirectoryRule {

    protected AbstractDirectoryRule() {
        super();
    }

    /**
     * Returns the {@code .tf} files of the directory that parsed cleanly.
     *
     * @param context directory context
     * @return structurally sound configuration files in traversal order
     */
    protected List<ParsedFile> configurationFiles(DirectoryContext context) {
        return context.files().stream()
            .filter(f -> FileUtils.isConfigurationFile(f.path()))
            .filter(f -> !f.hasParseError())
            .toList();
    }
}
