package com.terralint.core.util;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code major.minor.patch} version. A missing patch component counts as 0.
 *
 * @param major major version
 * @param minor minor version
 * @param patch patch version
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    private static final Pattern VERSION = Pattern.compile("v?(\\d+)\\.(\\d+)(?:\\.(\\d+))?");

    private static final Comparator<SemanticVersion> ORDER = Comparator
        .comparingInt(SemanticVersion::major)
        .thenComparingInt(SemanticVersion::minor)
        .thenComparingInt(SemanticVersion::patch);

    /**
     * Parses a whole string as a version, e.g. {@code 1.3.0}, {@code 1.3} or {@code v1.3.0}.
     *
     * @param text version text
     * @return version, or empty if the text is not a version
     */
    public static Optional<SemanticVersion> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = VERSION.matcher(text.trim());
        return matcher.matches() ? Optional.of(fromMatch(matcher)) : Optional.empty();
    }

    /**
     * Finds the first version number anywhere in the text, e.g. in {@code ">= 1.3, < 2.0"}.
     *
     * @param text text to search
     * @return first version found
     */
    public static Optional<SemanticVersion> findFirst(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = VERSION.matcher(text);
        return matcher.find() ? Optional.of(fromMatch(matcher)) : Optional.empty();
    }

    private static SemanticVersion fromMatch(Matcher matcher) {
        int patch = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;
        return new SemanticVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), patch);
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    public boolean isAtLeast(SemanticVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
