package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.model.SourceFile;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractLineRule;

/**
 * ST.012: a file starts with content and ends with exactly one newline.
 *
 * <p>Whitespace-only lines count as empty. The final newline of a file shows up as one
 * empty line after the last line of content, so a file that ends with a single newline has
 * exactly one trailing empty line. Both violations are reported at the nearest line of content.
 * Empty files are not checked.</p>
 *
 * @since 1.0.0
 */
public class FileBoundaryBlankLineRule extends AbstractLineRule {

    public static final String RULE_ID = "ST.012";
    private static final String DISPLAY_NAME = "File leading and trailing blank lines";

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
    public void check(FileContext context, ViolationSink sink) {
        SourceFile source = context.source();
        int first = 1;
        while (first <= source.lineCount() && source.line(first).isBlank()) {
            first++;
        }
        if (first > source.lineCount()) {
            return;
        }
        int leading = first - 1;
        if (leading > 0) {
            sink.report(context.path(), first,
                "File has " + leading + " empty " + (leading == 1 ? "line" : "lines")
                    + " before first non-empty line (should have 0)");
        }

        int last = source.lineCount();
        while (source.line(last).isBlank()) {
            last--;
        }
        int trailing = source.lineCount() - last;
        if (trailing != 1) {
            sink.report(context.path(), last,
                "File has " + trailing + " empty lines after last non-empty line (should have 1)");
        }
    }
}
