package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.RuleSettings;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ST.009: variables are defined in the order the main file first uses them.
 *
 * <p>The first-use order of {@code var.NAME} in the main file is compared with the
 * definition order in the variables file. Only variables that appear in both and are not
 * allow-listed take part, and at least two are needed. The longest common subsequence of
 * the two orders is considered correctly placed; every other variable is reported at its
 * definition line.</p>
 *
 * @since 1.0.0
 */
public class VariableOrderRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "ST.009";
    private static final String DISPLAY_NAME = "Variable definition order";

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
        return Severity.WARNING;
    }

    @Override
    public boolean appliesTo(DirectoryContext context) {
        return context.mainFile().isPresent() && context.variablesFile().isPresent();
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        ParsedFile main = context.mainFile().orElseThrow();
        ParsedFile variables = context.variablesFile().orElseThrow();
        RuleSettings settings = context.settings();
        DirectoryIndex index = context.index();

        List<DirectoryIndex.Definition> definitions = index.variables().stream()
            .filter(d -> d.file().equals(variables.path()))
            .filter(d -> !settings.isAllowListed(d.name()))
            .toList();
        Set<String> defined = new HashSet<>();
        definitions.forEach(d -> defined.add(d.name()));

        Set<String> used = new LinkedHashSet<>();
        for (DirectoryIndex.Reference reference : index.referencesIn(main.path())) {
            if (defined.contains(reference.name())) {
                used.add(reference.name());
            }
        }
        if (used.size() < 2) {
            return;
        }

        List<String> expected = new ArrayList<>(used);
        List<DirectoryIndex.Definition> current = definitions.stream()
            .filter(d -> used.contains(d.name()))
            .toList();
        List<String> currentNames = current.stream().map(DirectoryIndex.Definition::name).toList();
        if (expected.equals(currentNames)) {
            return;
        }

        Set<String> inOrder = new HashSet<>(longestCommonSubsequence(expected, currentNames));
        String expectedText = String.join(", ", expected);
        String currentText = String.join(", ", currentNames);
        for (DirectoryIndex.Definition definition : current) {
            if (!inOrder.contains(definition.name())) {
                sink.report(definition.file(), definition.line(),
                    "Variable '" + definition.name() + "' is not in the correct order. Expected order: "
                        + expectedText + ". Current order: " + currentText);
            }
        }
    }

    /**
     * Computes a longest common subsequence of two name sequences.
     *
     * @param a first sequence
     * @param b second sequence
     * @return names of one longest common subsequence, in order
     */
    static List<String> longestCommonSubsequence(List<String> a, List<String> b) {
        int[][] lengths = new int[a.size() + 1][b.size() + 1];
        for (int i = a.size() - 1; i >= 0; i--) {
            for (int j = b.size() - 1; j >= 0; j--) {
                lengths[i][j] = a.get(i).equals(b.get(j))
                    ? lengths[i + 1][j + 1] + 1
                    : Math.max(lengths[i + 1][j], lengths[i][j + 1]);
            }
        }
        List<String> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < a.size() && j < b.size()) {
            if (a.get(i).equals(b.get(j))) {
                result.add(a.get(i));
                i++;
                j++;
            } else if (lengths[i + 1][j] >= lengths[i][j + 1]) {
                i++;
            } else {
                j++;
            }
        }
        return result;
    }
}
