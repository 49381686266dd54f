package com.terralint.core.rule.impl.security;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;
import com.terralint.core.util.VersionConstraints;

import java.util.List;
import java.util.Optional;

/**
 * SC.002: the providers file pins the Terraform version.
 *
 * <p>The providers file ({@code files.providers}) must hold a {@code terraform} block with
 * a {@code required_version} constraint of a recognised form: {@code >= x.y.z},
 * {@code ~> x.y}, {@code = x.y.z} or a {@code >= a, < b} range.</p>
 *
 * @since 1.0.0
 */
public class RequiredVersionDeclarationRule extends AbstractFileRule {

    public static final String RULE_ID = "SC.002";
    private static final String DISPLAY_NAME = "Terraform required version declaration";

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
    public boolean appliesTo(FileContext context) {
        return context.fileName().equals(context.settings().files().providers());
    }

    @Override
    public void check(FileContext context, ViolationSink sink) {
        List<Block> terraformBlocks = topLevel(context, BlockKind.TERRAFORM);
        if (terraformBlocks.isEmpty()) {
            sink.report(context.path(), 1, "Missing terraform block with required_version declaration");
            return;
        }
        Optional<Parameter> requiredVersion = terraformBlocks.stream()
            .map(block -> block.parameter("required_version"))
            .flatMap(Optional::stream)
            .findFirst();
        if (requiredVersion.isEmpty()) {
            sink.report(context.path(), terraformBlocks.get(0).startLine(),
                "terraform block found but missing required_version declaration");
            return;
        }
        String constraint = requiredVersion.get().unquotedValue();
        if (!VersionConstraints.isWellFormed(constraint)) {
            sink.report(context.path(), requiredVersion.get().line(),
                "Invalid version constraint format: '" + constraint + "'. Use format like '>= 1.3.0' or '~> 1.0'");
        }
    }
}
