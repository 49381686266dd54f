package com.terralint.core.rule;

import com.terralint.core.rule.impl.doc.CommentFormatRule;
import com.terralint.core.rule.impl.io.OutputDescriptionRule;
import com.terralint.core.rule.impl.io.OutputLocationRule;
import com.terralint.core.rule.impl.io.OutputNamingRule;
import com.terralint.core.rule.impl.io.RequiredVariableDeclarationRule;
import com.terralint.core.rule.impl.io.UnusedVariableRule;
import com.terralint.core.rule.impl.io.VariableDescriptionRule;
import com.terralint.core.rule.impl.io.VariableLocationRule;
import com.terralint.core.rule.impl.io.VariableNamingRule;
import com.terralint.core.rule.impl.io.VariableTypeRule;
import com.terralint.core.rule.impl.security.ProviderVersionRule;
import com.terralint.core.rule.impl.security.RequiredVersionDeclarationRule;
import com.terralint.core.rule.impl.security.SensitiveVariableRule;
import com.terralint.core.rule.impl.security.UnsafeIndexAccessRule;
import com.terralint.core.rule.impl.security.VersionCompatibilityRule;
import com.terralint.core.rule.impl.style.BlockSpacingRule;
import com.terralint.core.rule.impl.style.DataSourceVariableDefaultRule;
import com.terralint.core.rule.impl.style.DifferentGroupSpacingRule;
import com.terralint.core.rule.impl.style.DirectoryNamingRule;
import com.terralint.core.rule.impl.style.FileBoundaryBlankLineRule;
import com.terralint.core.rule.impl.style.FileNamingRule;
import com.terralint.core.rule.impl.style.IndentationCharacterRule;
import com.terralint.core.rule.impl.style.IndentationLevelRule;
import com.terralint.core.rule.impl.style.InstanceNameRule;
import com.terralint.core.rule.impl.style.ParameterAlignmentRule;
import com.terralint.core.rule.impl.style.QuoteUsageRule;
import com.terralint.core.rule.impl.style.SameGroupSpacingRule;
import com.terralint.core.rule.impl.style.TrailingWhitespaceRule;
import com.terralint.core.rule.impl.style.VariableOrderRule;

import java.util.List;

/**
 * The table of built-in rules.
 *
 * <p>Rules are listed explicitly rather than discovered at runtime; adding a rule means
 * adding it here.</p>
 */
public final class BuiltInRules {

    private BuiltInRules() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Creates one instance of every built-in rule.
     *
     * @return rules in id order
     */
    public static List<LintRule> all() {
        return List.of(
            new InstanceNameRule(),
            new DataSourceVariableDefaultRule(),
            new ParameterAlignmentRule(),
            new IndentationCharacterRule(),
            new IndentationLevelRule(),
            new BlockSpacingRule(),
            new SameGroupSpacingRule(),
            new DifferentGroupSpacingRule(),
            new VariableOrderRule(),
            new QuoteUsageRule(),
            new TrailingWhitespaceRule(),
            new FileBoundaryBlankLineRule(),
            new DirectoryNamingRule(),
            new FileNamingRule(),

            new VariableLocationRule(),
            new OutputLocationRule(),
            new RequiredVariableDeclarationRule(),
            new VariableNamingRule(),
            new OutputNamingRule(),
            new VariableDescriptionRule(),
            new OutputDescriptionRule(),
            new VariableTypeRule(),
            new UnusedVariableRule(),

            new CommentFormatRule(),

            new UnsafeIndexAccessRule(),
            new RequiredVersionDeclarationRule(),
            new VersionCompatibilityRule(),
            new ProviderVersionRule(),
            new SensitiveVariableRule()
        );
    }
}
