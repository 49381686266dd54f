package com.terralint.core.rule.impl.io;

import com.terralint.core.model.Parameter;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryIndex;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * IO.003: every required variable has a value in the variable values file.
 *
 * <p>A variable is required when it has no {@code default}. Allow-listed variables, such as
 * credentials and region names supplied by the environment, are exempt. The keys of the
 * values file are its top-level assignments; a missing values file declares nothing. Each
 * missing variable is reported at its definition line.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * # variables.tf
 * variable "vpc_name" {
 *   type = string
 * }
 *
 * # terraform.tfvars
 * vpc_name = "test-vpc"
 * }</pre>
 *
 * @since 1.0.0
 */
public class RequiredVariableDeclarationRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "IO.003";
    private static final String DISPLAY_NAME = "Required variable declaration";

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
        return RuleCategory.IO;
    }

    @Override
    public Severity getSeverity() {
        return Severity.ERROR;
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        String tfvarsName = context.settings().files().tfvars();
        Set<String> declared = declaredKeys(context.tfvarsFile());
        for (DirectoryIndex.Definition definition : context.index().variables()) {
            if (definition.hasDefault() || context.settings().isAllowListed(definition.name())) {
                continue;
            }
            if (!declared.contains(definition.name())) {
                sink.report(definition.file(), definition.line(),
                    "Required variable '" + definition.name() + "' used and must be declared in " + tfvarsName);
            }
        }
    }

    private Set<String> declaredKeys(Optional<ParsedFile> tfvars) {
        if (tfvars.isEmpty()) {
            log.debug("No variable values file found; treating every required variable as undeclared");
            return Set.of();
        }
        return tfvars.get().root().parameters().stream()
            .map(Parameter::name)
            .collect(Collectors.toSet());
    }
}
