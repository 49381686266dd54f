package com.terralint.core.util;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and evaluation of Terraform version constraint strings such as
 * {@code ">= 1.3.0"}, {@code "~> 1.0"} or {@code ">= 0.14.0, < 2.0.0"}.
 */
public final class VersionConstraints {

    private static final String VERSION = "\\d+\\.\\d+(?:\\.\\d+)?";
    private static final String FULL_VERSION = "\\d+\\.\\d+\\.\\d+";

    /**
     * Forms accepted for {@code required_version}.
     */
    private static final List<Pattern> WELL_FORMED = List.of(
        Pattern.compile("^\\s*>=?\\s*" + VERSION + "\\s*$"),
        Pattern.compile("^\\s*<=?\\s*" + VERSION + "\\s*$"),
        Pattern.compile("^\\s*~\\s*>\\s*" + VERSION + "\\s*$"),
        Pattern.compile("^\\s*=\\s*" + VERSION + "\\s*$"),
        Pattern.compile("^\\s*>=?\\s*" + VERSION + "\\s*,\\s*<=?\\s*" + VERSION + "\\s*$")
    );

    /**
     * Forms from which a provider's minimum version can be read. Group 1 is the minimum.
     */
    private static final List<Pattern> MINIMUM_FORMS = List.of(
        Pattern.compile("^(" + FULL_VERSION + ")$"),
        Pattern.compile("^>=\\s*(" + FULL_VERSION + ")$"),
        Pattern.compile("^>\\s*(" + FULL_VERSION + ")$"),
        Pattern.compile("^~>\\s*(" + FULL_VERSION + ")$"),
        Pattern.compile("^(" + FULL_VERSION + ")\\s*-\\s*" + FULL_VERSION + "$")
    );

    private static final Pattern CLAUSE = Pattern.compile("^\\s*(>=|<=|!=|~>|>|<|=)?\\s*(" + VERSION + ")\\s*$");

    private static final Pattern RANGE = Pattern.compile("^\\s*(" + VERSION + ")\\s*-\\s*(" + VERSION + ")\\s*$");

    private VersionConstraints() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns true when a {@code required_version} value has one of the accepted forms.
     *
     * @param constraint constraint text
     * @return true if well formed
     */
    public static boolean isWellFormed(String constraint) {
        String trimmed = constraint.trim();
        return WELL_FORMED.stream().anyMatch(pattern -> pattern.matcher(trimmed).matches());
    }

    /**
     * Reads the minimum version of a provider constraint. Accepts an exact version,
     * {@code >=}, {@code >}, {@code ~>} and a {@code low - high} range, each with a full
     * {@code x.y.z} version.
     *
     * @param constraint constraint text
     * @return minimum version, or empty if the constraint has another form
     */
    public static Optional<SemanticVersion> minimumVersion(String constraint) {
        String trimmed = constraint.trim();
        for (Pattern pattern : MINIMUM_FORMS) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.matches()) {
                return SemanticVersion.parse(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Reads the lower bound of a {@code required_version} constraint: the first version in it.
     *
     * @param constraint constraint text
     * @return first version found, or empty
     */
    public static Optional<SemanticVersion> lowerBound(String constraint) {
        return SemanticVersion.findFirst(constraint);
    }

    /**
     * Evaluates a constraint against a version. Clauses are separated by commas and must all
     * hold. {@code ~> 1.2} allows {@code 1.x} from 1.2; {@code ~> 1.2.3} allows {@code 1.2.x}
     * from 1.2.3.
     *
     * @param version candidate version
     * @param constraint constraint text
     * @return true if the version satisfies every clause
     * @throws IllegalArgumentException if a clause cannot be parsed
     */
    public static boolean isSatisfiedBy(SemanticVersion version, String constraint) {
        Matcher range = RANGE.matcher(constraint);
        if (range.matches()) {
            SemanticVersion low = SemanticVersion.parse(range.group(1)).orElseThrow();
            SemanticVersion high = SemanticVersion.parse(range.group(2)).orElseThrow();
            return version.isAtLeast(low) && high.isAtLeast(version);
        }
        for (String clause : constraint.split(",")) {
            Matcher matcher = CLAUSE.matcher(clause);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Unsupported version constraint clause: '" + clause.trim() + "'");
            }
            String operator = matcher.group(1) == null ? "=" : matcher.group(1);
            String bound = matcher.group(2);
            SemanticVersion target = SemanticVersion.parse(bound).orElseThrow();
            int cmp = version.compareTo(target);
            boolean holds = switch (operator) {
                case ">=" -> cmp >= 0;
                case ">" -> cmp > 0;
                case "<=" -> cmp <= 0;
                case "<" -> cmp < 0;
                case "!=" -> cmp != 0;
                case "~>" -> cmp >= 0 && pessimisticUpperBound(target, bound).compareTo(version) > 0;
                default -> cmp == 0;
            };
            if (!holds) {
                return false;
            }
        }
        return true;
    }

    private static SemanticVersion pessimisticUpperBound(SemanticVersion target, String bound) {
        boolean hasPatch = bound.chars().filter(c -> c == '.').count() == 2;
        return hasPatch
            ? new SemanticVersion(target.major(), target.minor() + 1, 0)
            : new SemanticVersion(target.major() + 1, 0, 0);
    }
}
