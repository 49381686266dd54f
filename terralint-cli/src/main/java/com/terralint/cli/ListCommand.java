package com.terralint.cli;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.rule.RuleDescriptor;
import com.terralint.core.rule.RuleRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list the built-in rules or the rule categories.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all rules
 * terralint list rules
 *
 * # List categories with their rule counts
 * terralint list categories
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available rules or rule categories",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: rules or categories",
        defaultValue = "rules"
    )
    private String type;

    @Override
    public Integer call() {
        RuleRegistry registry = RuleRegistry.builtIn();
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "rules", "rule" -> listRules(registry, out);
            case "categories", "category" -> listCategories(registry, out);
            default -> {
                log.error("Unknown type: {}. Use: rules or categories", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: rules or categories");
                yield 1;
            }
        };
    }

    private int listRules(RuleRegistry registry, PrintWriter out) {
        out.println("Available Rules:");
        out.println();
        for (RuleCategory category : RuleCategory.values()) {
            List<RuleDescriptor> rules = registry.all().stream()
                .filter(d -> d.category() == category)
                .toList();
            if (rules.isEmpty()) {
                continue;
            }
            out.printf("  %s (%s)%n", category.name(), category.displayName());
            for (RuleDescriptor rule : rules) {
                out.printf("    • %-7s %-8s %-9s %s%n", rule.id(), rule.severity().label(),
                    rule.isDirectoryRule() ? "directory" : "file", rule.displayName());
            }
            out.println();
        }
        out.printf("Total: %d rules%n", registry.size());
        return 0;
    }

    private int listCategories(RuleRegistry registry, PrintWriter out) {
        out.println("Rule Categories:");
        out.println();
        for (RuleCategory category : RuleCategory.values()) {
            long count = registry.all().stream().filter(d -> d.category() == category).count();
            out.printf("  • %s - %s (%d rules)%n", category.name(), category.displayName(), count);
        }
        return 0;
    }
}
