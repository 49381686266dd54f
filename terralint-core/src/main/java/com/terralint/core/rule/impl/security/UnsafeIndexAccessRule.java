package com.terralint.core.rule.impl.security;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;
import com.terralint.core.rule.base.TerraformPatterns;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SC.001: index access into lists that may be empty is wrapped in {@code try()}.
 *
 * <p><b>Detected access chains:</b>
 * <ul>
 *   <li>{@code data.TYPE.NAME.ATTR[i]}: a data source list attribute, empty when nothing
 *       matches the query</li>
 *   <li>{@code var.NAME[i]} where the variable's type is a list</li>
 *   <li>{@code local.NAME[i]} where the local is computed by a {@code for} expression</li>
 * </ul>
 *
 * <p>An access is safe when some enclosing call on the same line is {@code try(...)}.
 * Variable types and locals are looked up across the directory, so this is a directory
 * rule.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * flavor_id = data.huaweicloud_compute_flavors.test.ids[0]                 # SC.001
 * flavor_id = try(data.huaweicloud_compute_flavors.test.ids[0], null)      # ok
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnsafeIndexAccessRule extends AbstractDirectoryRule {

    private static final String CHAIN_TAIL = "\\[\\d+\\](?:\\.[\\w-]+|\\[\\d+\\])*";

    private static final Pattern DATA_INDEX =
        Pattern.compile("\\bdata\\.[\\w-]+\\.[\\w-]+\\.[\\w-]+" + CHAIN_TAIL);

    private static final Pattern VARIABLE_INDEX =
        Pattern.compile("\\bvar\\.([\\w-]+)" + CHAIN_TAIL);

    private static final Pattern LOCAL_INDEX =
        Pattern.compile("\\blocal\\.([\\w-]+)" + CHAIN_TAIL);

    private static final Pattern FOR_EXPRESSION = Pattern.compile("[\\[{]\\s*for\\s");

    public static final String RULE_ID = "SC.001";
    private static final String DISPLAY_NAME = "Array index access safety";

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
        return RuleCategory.SC;
    }

    @Override
    public Severity getSeverity() {
        return Severity.WARNING;
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        Set<String> forLocals = forExpressionLocals(context);
        DirectoryIndex index = context.index();
        for (ParsedFile file : configurationFiles(context)) {
            for (LineInfo line : file.lines()) {
                if (!line.isCode()) {
                    continue;
                }
                Matcher data = DATA_INDEX.matcher(line.masked());
                while (data.find()) {
                    report(file, line, data, "data source list attribute", sink);
                }
                Matcher variables = VARIABLE_INDEX.matcher(line.masked());
                while (variables.find()) {
                    if (isListVariable(index, variables.group(1))) {
                        report(file, line, variables, "optional list parameter", sink);
                    }
                }
                Matcher locals = LOCAL_INDEX.matcher(line.masked());
                while (locals.find()) {
                    if (forLocals.contains(locals.group(1))) {
                        report(file, line, locals, "for expression result", sink);
                    }
                }
            }
        }
    }

    private static void report(ParsedFile file, LineInfo line, MatchResult match, String scenario, ViolationSink sink) {
        if (TerraformPatterns.isInsideTry(line.masked(), match.start())) {
            return;
        }
        String access = match.group();
        sink.report(file.path(), line.number(),
            "Unsafe array index access detected in " + scenario + ": '" + access + "'. Use try() function to "
                + "prevent index out of bounds errors. Suggestion: try(" + access + ", \"default_value\")");
    }

    private static boolean isListVariable(DirectoryIndex index, String name) {
        return index.variable(name)
            .flatMap(definition -> definition.block().parameter("type"))
            .map(type -> type.value().contains("list("))
            .orElse(false);
    }

    private static Set<String> forExpressionLocals(DirectoryContext context) {
        Set<String> names = new HashSet<>();
        for (ParsedFile file : context.files()) {
            if (file.hasParseError()) {
                continue;
            }
            for (Block locals : file.topLevel(BlockKind.LOCALS)) {
                for (Parameter local : locals.parameters()) {
                    if (isForExpression(file, local)) {
                        names.add(local.name());
                    }
                }
            }
        }
        return names;
    }

    private static boolean isForExpression(ParsedFile file, Parameter local) {
        StringBuilder value = new StringBuilder(local.value());
        for (int number = local.line() + 1; number <= local.endLine(); number++) {
            value.append(' ').append(file.line(number).masked());
        }
        return FOR_EXPRESSION.matcher(value).find();
    }
}
