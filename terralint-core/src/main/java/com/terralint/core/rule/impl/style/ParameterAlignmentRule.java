package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.ParameterShape;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.rule.base.Layout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ST.003: the {@code =} of consecutive parameters must line up, with one space after it.
 *
 * <p><b>Sections:</b> the parameters of a block body are split into sections. A blank line
 * ends a section, and so does a nested block. An object or list literal spanning several
 * lines takes part in the section it starts and ends it; its entries are aligned as sections
 * of their own, recursively. Other multi-line values (heredocs, wrapped expressions) stay in
 * the running section. Comment lines do not split sections.</p>
 *
 * <p><b>Expected layout:</b> with {@code M} the widest parameter name of a section (quotes of
 * a quoted name count), the {@code =} of every parameter sits at column
 * {@code indent + M + 1} and is followed by exactly one space. Parameters of a single-line
 * block body only need one space on each side of {@code =}.</p>
 *
 * <p>Lines with an indentation problem are skipped; they are already reported by ST.004 or
 * ST.005.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * resource "huaweicloud_vpc" "test" {
 *   name        = "vpc"
 *   cidr        = "192.168.0.0/16"
 *   description = "managed"
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class ParameterAlignmentRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.003";
    private static final String DISPLAY_NAME = "Parameter alignment";

    // name = value inside a single-line body. Captures: (1) spaces before '=', (2) spaces after
    private static final String INLINE_ASSIGNMENT = "(?<![\\w-])%s(\\s*)=(?![=>])(\\s*)";

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
        Set<Integer> reported = new HashSet<>();
        context.root().descendantsAndSelf().forEach(block -> {
            for (List<Parameter> section : sections(context.file(), block)) {
                checkSection(context, block, section, sink, reported);
            }
            for (Parameter parameter : block.parameters()) {
                if (parameter.inline()) {
                    checkInline(context, block, parameter, sink, reported);
                } else {
                    checkEntries(context, block, parameter, sink, reported);
                }
            }
        });
    }

    /**
     * Splits the body of a block into alignment sections.
     *
     * @param file parsed file
     * @param block block whose own parameters are split
     * @return sections in source order
     */
    static List<List<Parameter>> sections(ParsedFile file, Block block) {
        List<Object> members = new ArrayList<>();
        block.parameters().stream().filter(p -> !p.inline()).forEach(members::add);
        members.addAll(block.children());
        members.sort(Comparator.comparingInt(ParameterAlignmentRule::startLine));
        return split(file, members);
    }

    /**
     * Splits the entries of an object or list literal into alignment sections.
     *
     * @param file parsed file
     * @param parameter collection-valued parameter
     * @return sections in source order, empty for a scalar parameter
     */
    static List<List<Parameter>> entrySections(ParsedFile file, Parameter parameter) {
        return split(file, parameter.entries());
    }

    private static List<List<Parameter>> split(ParsedFile file, List<?> members) {
        List<List<Parameter>> sections = new ArrayList<>();
        List<Parameter> current = new ArrayList<>();
        for (Object member : members) {
            if (!(member instanceof Parameter parameter) || parameter.isAnonymous()) {
                close(sections, current);
                current = new ArrayList<>();
                continue;
            }
            if (!current.isEmpty()) {
                Parameter previous = current.get(current.size() - 1);
                if (Layout.blankLinesBetween(file, previous.endLine(), parameter.line()) > 0) {
                    close(sections, current);
                    current = new ArrayList<>();
                }
            }
            current.add(parameter);
            if (parameter.shape() == ParameterShape.COLLECTION_LITERAL && parameter.isMultiLine()) {
                close(sections, current);
                current = new ArrayList<>();
            }
        }
        close(sections, current);
        return sections;
    }

    private static void close(List<List<Parameter>> sections, List<Parameter> section) {
        if (!section.isEmpty()) {
            sections.add(section);
        }
    }

    private static int startLine(Object member) {
        return member instanceof Parameter p ? p.line() : ((Block) member).startLine();
    }

    private void checkEntries(FileContext context, Block block, Parameter parameter,
                              ViolationSink sink, Set<Integer> reported) {
        if (parameter.entries().isEmpty()) {
            return;
        }
        for (List<Parameter> section : entrySections(context.file(), parameter)) {
            checkSection(context, block, section, sink, reported);
        }
        for (Parameter entry : parameter.entries()) {
            checkEntries(context, block, entry, sink, reported);
        }
    }

    private void checkSection(FileContext context, Block block, List<Parameter> section,
                              ViolationSink sink, Set<Integer> reported) {
        int width = section.stream().mapToInt(Parameter::nameWidth).max().orElse(0);
        for (Parameter parameter : section) {
            LineInfo line = context.line(parameter.line());
            if (!line.isCode() || Layout.hasIndentationProblem(line) || reported.contains(line.number())) {
                continue;
            }
            int equals = line.masked().indexOf('=');
            if (equals < 0) {
                continue;
            }
            int expected = Layout.leadingSpaces(line) + width + 1;
            String text = line.text();
            if (equals != expected) {
                reported.add(line.number());
                sink.report(context.path(), line.number(),
                    "Parameter assignment not aligned with other parameters in " + block.describe()
                        + " (expected '=' at column " + (expected + 1) + ", found column " + (equals + 1) + ")");
            } else if (!hasSingleSpaceAfter(text, equals)) {
                reported.add(line.number());
                sink.report(context.path(), line.number(),
                    "Parameter assignment should have exactly one space after '=' in " + block.describe());
            }
        }
    }

    private void checkInline(FileContext context, Block block, Parameter parameter,
                             ViolationSink sink, Set<Integer> reported) {
        LineInfo line = context.line(parameter.line());
        if (!line.isCode() || reported.contains(line.number())) {
            return;
        }
        String name = parameter.quotedName() ? "\"" + parameter.name() + "\"" : parameter.name();
        Pattern pattern = Pattern.compile(String.format(INLINE_ASSIGNMENT, Pattern.quote(name)));
        Matcher matcher = pattern.matcher(line.code());
        if (!matcher.find()) {
            return;
        }
        if (!" ".equals(matcher.group(1)) || !" ".equals(matcher.group(2))) {
            reported.add(line.number());
            sink.report(context.path(), line.number(),
                "Parameter '" + parameter.name() + "' should have exactly one space before and after '=' in "
                    + block.describe());
        }
    }

    private static boolean hasSingleSpaceAfter(String text, int equals) {
        if (equals + 1 >= text.length()) {
            return true;
        }
        if (text.charAt(equals + 1) != ' ') {
            return false;
        }
        return equals + 2 >= text.length() || text.charAt(equals + 2) != ' ';
    }
}
