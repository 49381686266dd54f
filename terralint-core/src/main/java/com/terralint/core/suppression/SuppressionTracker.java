package com.terralint.core.suppression;

import com.terralint.core.model.SourceFile;
import com.terralint.core.model.SuppressionRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans a file's comment lines for per-rule {@code Disable} / {@code Enable} directives.
 *
 * <pre>
 * # ST.001 Disable
 * resource "aws_vpc" "main" { ... }   # ST.001 is not reported here
 * # ST.001 Enable
 * </pre>
 *
 * <p>The scan is purely lexical and independent of block extraction, so directives work in
 * files that fail to parse. Disable opens a range on the next line; Enable closes it and
 * is itself still suppressed. A range without Enable runs to end of file. Disabling a rule
 * that is already disabled keeps the earlier start; an Enable with nothing open is ignored.</p>
 */
public class SuppressionTracker {

    private static final Logger log = LoggerFactory.getLogger(SuppressionTracker.class);

    private static final Pattern DIRECTIVE =
        Pattern.compile("^\\s*#\\s*([A-Z]{2}\\.\\d{3})\\s+(Enable|Disable)\\s*$");

    private static final Pattern DIRECTIVE_LIKE =
        Pattern.compile("#.*\\b([A-Za-z]{2}\\.\\d{3})\\s+(?i:enable|disable)\\b");

    /**
     * Builds the suppression map of one file.
     *
     * @param source file to scan
     * @return ranges per rule id
     */
    public SuppressionMap scan(SourceFile source) {
        Map<String, Integer> open = new LinkedHashMap<>();
        Map<String, List<SuppressionRange>> ranges = new HashMap<>();
        List<SuppressionMap.MalformedDirective> malformed = new ArrayList<>();

        for (int number = 1; number <= source.lineCount(); number++) {
            String text = source.line(number);
            Matcher matcher = DIRECTIVE.matcher(text);
            if (matcher.matches()) {
                String ruleId = matcher.group(1);
                if ("Disable".equals(matcher.group(2))) {
                    open.putIfAbsent(ruleId, number + 1);
                } else {
                    Integer start = open.remove(ruleId);
                    if (start != null) {
                        ranges.computeIfAbsent(ruleId, k -> new ArrayList<>())
                            .add(new SuppressionRange(ruleId, source.path(), start, number));
                    }
                }
            } else if (DIRECTIVE_LIKE.matcher(text).find()) {
                log.debug("Malformed suppression directive in {} at line {}: {}", source.path(), number, text.trim());
                malformed.add(new SuppressionMap.MalformedDirective(number, text.trim()));
            }
        }

        for (Map.Entry<String, Integer> entry : open.entrySet()) {
            ranges.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                .add(new SuppressionRange(entry.getKey(), source.path(), entry.getValue(), SuppressionRange.OPEN_END));
        }
        return new SuppressionMap(source.path(), ranges, malformed);
    }
}
