package com.terralint.core.rule.impl.style;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractLineRule;
import com.terralint.core.rule.base.Layout;

/**
 * ST.004: indentation uses spaces only.
 *
 * <p>A tab in the leading whitespace is reported as mixed indentation when spaces are also
 * present, otherwise as tab indentation. A tab elsewhere on a code line is reported unless
 * it sits inside a string literal. Heredoc bodies are left alone.</p>
 *
 * @since 1.0.0
 */
public class IndentationCharacterRule extends AbstractLineRule {

    public static final String RULE_ID = "ST.004";
    private static final String DISPLAY_NAME = "Indentation character";

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
        for (LineInfo line : context.lines()) {
            if (line.isHeredoc()) {
                continue;
            }
            String indentation = line.leadingWhitespace();
            if (Layout.hasTabInIndentation(line)) {
                String message = indentation.indexOf(' ') >= 0
                    ? "Mixed indentation detected (tabs and spaces). Use spaces only for consistent formatting"
                    : "Tab character used for indentation. Use spaces instead for consistent formatting";
                sink.report(context.path(), line.number(), message);
            } else if (line.isCode() && line.masked().indexOf('\t', indentation.length()) >= 0) {
                sink.report(context.path(), line.number(),
                    "Tab character found outside string literal. Use spaces instead for consistent formatting");
            }
        }
    }
}
