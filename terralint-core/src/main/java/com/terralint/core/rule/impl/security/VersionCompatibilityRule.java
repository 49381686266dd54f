package com.terralint.core.rule.impl.security;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;
import com.terralint.core.rule.base.TerraformPatterns;
import com.terralint.core.util.SemanticVersion;
import com.terralint.core.util.VersionConstraints;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * SC.003: the declared Terraform version supports every language feature the directory
 * uses.
 *
 * <p><b>Feature table:</b>
 * <ul>
 *   <li>{@code sensitive = true} on a variable: 0.14.0</li>
 *   <li>{@code nullable} on a variable: 1.1.0</li>
 *   <li>{@code optional(...)} in a variable type: 1.3.0</li>
 *   <li>lifecycle {@code precondition} / {@code postcondition}: 1.2.0</li>
 *   <li>a variable validation that references another variable: 1.9.0</li>
 *   <li>an {@code import} block with {@code for_each}: 1.7.0</li>
 * </ul>
 *
 * <p>Without any of them the baseline is 0.12.0.</p>
 *
 * <p>The first version in the providers file's {@code required_version} is the declared
 * minimum. When it is below the highest required version the violation names every
 * feature that needs more than the declared minimum.</p>
 *
 * @since 1.0.0
 */
public class VersionCompatibilityRule extends AbstractDirectoryRule {

    static final SemanticVersion BASELINE = new SemanticVersion(0, 12, 0);

    public static final String RULE_ID = "SC.003";
    private static final String DISPLAY_NAME = "Terraform version compatibility";

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
        return Severity.ERROR;
    }

    @Override
    public boolean appliesTo(DirectoryContext context) {
        return context.providersFile().filter(file -> !file.hasParseError()).isPresent();
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        ParsedFile providers = context.providersFile().orElseThrow();
        Optional<Parameter> requiredVersion = providers.topLevel(BlockKind.TERRAFORM).stream()
            .map(block -> block.parameter("required_version"))
            .flatMap(Optional::stream)
            .findFirst();
        if (requiredVersion.isEmpty()) {
            return;
        }
        String declared = requiredVersion.get().unquotedValue();
        Optional<SemanticVersion> declaredMinimum = VersionConstraints.lowerBound(declared);
        if (declaredMinimum.isEmpty()) {
            return;
        }

        Map<String, SemanticVersion> features = new LinkedHashMap<>();
        for (ParsedFile file : configurationFiles(context)) {
            collectFeatures(file, features);
        }
        SemanticVersion required = features.values().stream().max(SemanticVersion::compareTo).orElse(BASELINE);
        if (declaredMinimum.get().compareTo(required) >= 0) {
            return;
        }

        List<String> offending = new ArrayList<>();
        features.forEach((feature, version) -> {
            if (version.compareTo(declaredMinimum.get()) > 0) {
                offending.add(feature);
            }
        });
        String basis = offending.size() == 1
            ? "based on feature '" + offending.get(0) + "' used"
            : "based on features '" + String.join("', '", offending) + "' used";
        sink.report(providers.path(), requiredVersion.get().line(),
            "Declared version '" + declared + "' is too low. Required: '>= " + required + "' " + basis);
    }

    private static void collectFeatures(ParsedFile file, Map<String, SemanticVersion> features) {
        for (Block variable : file.topLevel(BlockKind.VARIABLE)) {
            variable.parameter("sensitive")
                .filter(p -> TerraformPatterns.isTrueLiteral(p.value()))
                .ifPresent(p -> features.putIfAbsent("sensitive", new SemanticVersion(0, 14, 0)));
            if (variable.hasParameter("nullable")) {
                features.putIfAbsent("nullable", new SemanticVersion(1, 1, 0));
            }
            variable.parameter("type")
                .filter(p -> spanText(file, p).contains("optional("))
                .ifPresent(p -> features.putIfAbsent("optional()", new SemanticVersion(1, 3, 0)));
            String name = variable.nameLabel().orElse("");
            for (Block validation : variable.children()) {
                if ("validation".equals(validation.keyword()) && referencesOtherVariable(file, validation, name)) {
                    features.putIfAbsent("other variables are referenced in validation.condition",
                        new SemanticVersion(1, 9, 0));
                }
            }
        }
        file.root().descendantsAndSelf()
            .filter(block -> "lifecycle".equals(block.keyword()))
            .flatMap(block -> block.children().stream())
            .filter(child -> "precondition".equals(child.keyword()) || "postcondition".equals(child.keyword()))
            .forEach(child -> features.putIfAbsent("lifecycle." + child.keyword(), new SemanticVersion(1, 2, 0)));
        for (Block block : file.root().children()) {
            if ("import".equals(block.keyword()) && block.hasParameter("for_each")) {
                features.putIfAbsent("import.for_each", new SemanticVersion(1, 7, 0));
            }
        }
    }

    private static String spanText(ParsedFile file, Parameter parameter) {
        StringBuilder text = new StringBuilder();
        for (int number = parameter.line(); number <= parameter.endLine(); number++) {
            text.append(file.line(number).code()).append('\n');
        }
        return text.toString();
    }

    private static boolean referencesOtherVariable(ParsedFile file, Block validation, String ownName) {
        for (int number = validation.startLine(); number <= validation.endLine(); number++) {
            Matcher matcher = TerraformPatterns.VARIABLE_REFERENCE.matcher(file.line(number).code());
            while (matcher.find()) {
                if (!matcher.group(1).equals(ownName)) {
                    return true;
                }
            }
        }
        return false;
    }
}
