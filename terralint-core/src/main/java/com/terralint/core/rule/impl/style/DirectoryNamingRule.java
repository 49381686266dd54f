package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ST.013: directory names use letters, digits and single hyphens, and start and end with a
 * letter.
 *
 * <p>Checks every directory that holds Terraform files. Hidden directories and build or
 * tool directories ({@code build}, {@code target}, {@code node_modules}, ...) are skipped.
 * The violation is attributed to the directory itself and carries no line.</p>
 *
 * @since 1.0.0
 */
public class DirectoryNamingRule extends AbstractDirectoryRule {

    public static final String RULE_ID = "ST.013";
    private static final String DISPLAY_NAME = "Directory naming";

    private static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9-]*[a-zA-Z]$");

    private static final Set<String> SKIPPED = Set.of(
        "__pycache__", "node_modules", "venv", "env", "build", "dist", "target", "bin", "obj",
        "coverage", "htmlcov", "terraform.tfstate.d");

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
    public boolean requiresStructure() {
        return false;
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        Path name = context.directory().toAbsolutePath().normalize().getFileName();
        if (name == null) {
            return;
        }
        String directoryName = name.toString();
        if (directoryName.startsWith(".") || SKIPPED.contains(directoryName.toLowerCase(Locale.ROOT))) {
            return;
        }
        if (!isValid(directoryName)) {
            sink.report(context.directory(), 0,
                "Directory name '" + directoryName + "' does not follow naming convention. Must contain only "
                    + "letters, numbers, and hyphens, and start/end with a letter.");
        }
    }

    static boolean isValid(String directoryName) {
        return VALID_NAME.matcher(directoryName).matches() && !directoryName.contains("--");
    }
}
