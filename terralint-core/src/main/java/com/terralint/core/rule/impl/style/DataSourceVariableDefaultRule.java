package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * ST.002: variables referenced inside data source blocks must declare a default.
 *
 * <p>Data sources are evaluated during plan. A data source that depends on a variable
 * without a default cannot be planned without extra input, which defeats its use for
 * discovery. Variables are looked up across every file of the directory.</p>
 *
 * <p>Each variable is reported once per file, at its first reference inside a data block.</p>
 *
 * @since 1.0.0
 */
public class DataSourceVariableDefaultRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "ST.002";
    private static final String DISPLAY_NAME = "Data source variable defaults";

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
    public void check(DirectoryContext context, ViolationSink sink) {
        DirectoryIndex index = context.index();
        for (ParsedFile file : configurationFiles(context)) {
            Set<String> reported = new HashSet<>();
            for (DirectoryIndex.Reference reference : index.referencesIn(file.path())) {
                if (!insideDataBlock(file, reference.line()) || !reported.add(reference.name())) {
                    continue;
                }
                Optional<DirectoryIndex.Definition> definition = index.variable(reference.name());
                if (definition.isEmpty()) {
                    sink.report(file.path(), reference.line(),
                        "Variable '" + reference.name() + "' used in data source is not defined in the current directory");
                } else if (!definition.get().hasDefault()) {
                    sink.report(file.path(), reference.line(),
                        "Variable '" + reference.name() + "' used in data source must have a default value");
                }
            }
        }
    }

    private static boolean insideDataBlock(ParsedFile file, int line) {
        for (Block block : file.topLevel(BlockKind.DATA)) {
            if (block.containsLine(line)) {
                return true;
            }
        }
        return false;
    }
}
