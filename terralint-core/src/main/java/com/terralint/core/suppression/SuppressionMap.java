package com.terralint.core.suppression;

import com.terralint.core.model.SuppressionRange;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Suppression ranges of one file, keyed by rule id. Read-only once built.
 *
 * @param file file the ranges belong to
 * @param ranges ranges per rule id, in directive order
 * @param malformed directives that mention a rule id and Enable/Disable but are not well formed
 */
public record SuppressionMap(
    Path file,
    Map<String, List<SuppressionRange>> ranges,
    List<MalformedDirective> malformed
) {
    /**
     * Compact constructor with validation.
     */
    public SuppressionMap {
        Objects.requireNonNull(file, "file must not be null");
        ranges = ranges == null ? Map.of() : Map.copyOf(ranges);
        malformed = malformed == null ? List.of() : List.copyOf(malformed);
    }

    /**
     * Creates a map without any ranges.
     *
     * @param file file path
     * @return empty map
     */
    public static SuppressionMap empty(Path file) {
        return new SuppressionMap(file, Map.of(), List.of());
    }

    /**
     * Returns true when the rule is disabled at the given line.
     *
     * @param ruleId rule id
     * @param line 1-based line number
     * @return true if some range of that rule covers the line
     */
    public boolean isSuppressed(String ruleId, int line) {
        List<SuppressionRange> forRule = ranges.get(ruleId);
        if (forRule == null) {
            return false;
        }
        for (SuppressionRange range : forRule) {
            if (range.covers(line)) {
                return true;
            }
        }
        return false;
    }

    public List<SuppressionRange> rangesFor(String ruleId) {
        return ranges.getOrDefault(ruleId, List.of());
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * A comment that looks like a directive but does not match the directive syntax.
     *
     * @param line line of the comment
     * @param text comment text
     */
    public record MalformedDirective(int line, String text) {
    }
}
