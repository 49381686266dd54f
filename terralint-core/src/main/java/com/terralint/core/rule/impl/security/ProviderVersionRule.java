package com.terralint.core.rule.impl.security;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.oracle.OracleException;
import com.terralint.core.oracle.ProviderVersionOracle;
import com.terralint.core.oracle.VersionVerdict;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractDirectoryRule;
import com.terralint.core.util.SemanticVersion;
import com.terralint.core.util.VersionConstraints;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SC.004: provider version constraints name a minimum version that really is the minimum.
 *
 * <p>For every provider listed in {@code versions.providers}, the version constraints of
 * {@code required_providers} (and of legacy {@code provider} blocks) are read and handed to
 * the {@link ProviderVersionOracle}. The oracle decides whether the declared minimum is
 * valid, too permissive (an older release also works), too restrictive (the declared
 * minimum does not work) or unresolvable.</p>
 *
 * <p>When the oracle cannot answer, the rule reports a single warning per provider and
 * moves on.</p>
 *
 * @since 1.0.0
 */
public class ProviderVersionRule extends AbstractDirectoryRule {

    // version = "..." inside a single-line provider requirement
    private static final Pattern INLINE_VERSION = Pattern.compile("\\bversion\\s*=\\s*\"([^\"]*)\"");

    public static final String RULE_ID = "SC.004";
    private static final String DISPLAY_NAME = "Provider minimum version validity";

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
        return Severity.ERROR;
    }

    @Override
    public void check(DirectoryContext context, ViolationSink sink) {
        List<String> providers = context.settings().providers();
        ProviderVersionOracle oracle = context.settings().oracle();
        Set<String> unavailable = new HashSet<>();

        for (ParsedFile file : configurationFiles(context)) {
            for (Requirement requirement : requirements(file, providers)) {
                if (unavailable.contains(requirement.provider())) {
                    continue;
                }
                Optional<SemanticVersion> minimum = VersionConstraints.minimumVersion(requirement.constraint());
                if (minimum.isEmpty()) {
                    sink.report(requirement.file(), requirement.line(),
                        "Invalid " + requirement.provider() + " provider version constraint: '"
                            + requirement.constraint() + "'");
                    continue;
                }
                try {
                    VersionVerdict verdict = oracle.isVersionValid(requirement.provider(), requirement.constraint());
                    report(requirement, minimum.get(), verdict, sink);
                } catch (OracleException e) {
                    log.warn("Could not verify {} provider versions: {}", requirement.provider(), e.getMessage());
                    unavailable.add(requirement.provider());
                    sink.report(requirement.file(), requirement.line(),
                        "Failed to verify " + requirement.provider() + " provider versions: " + e.getMessage(),
                        Severity.WARNING);
                }
            }
        }
    }

    private static void report(Requirement requirement, SemanticVersion minimum, VersionVerdict verdict,
                               ViolationSink sink) {
        String message = switch (verdict) {
            case VALID -> null;
            case TOO_PERMISSIVE -> "Version constraint '" + requirement.constraint() + "' is too permissive. "
                + "A previous provider version also works. Consider using a more restrictive version constraint.";
            case TOO_RESTRICTIVE -> "Version constraint '" + requirement.constraint() + "' is too restrictive. "
                + "Provider version '" + minimum + "' does not work with this configuration";
            case UNRESOLVABLE -> "Provider version '" + minimum + "' could not be resolved for "
                + requirement.provider() + " provider";
        };
        if (message != null) {
            sink.report(requirement.file(), requirement.line(), message);
        }
    }

    /**
     * Collects the version constraints of the given providers in one file.
     *
     * @param file parsed file
     * @param providers provider names to collect
     * @return requirements in source order
     */
    static List<Requirement> requirements(ParsedFile file, List<String> providers) {
        List<Requirement> result = new ArrayList<>();
        for (Block terraform : file.topLevel(BlockKind.TERRAFORM)) {
            for (Block required : terraform.children()) {
                if (!"required_providers".equals(required.keyword())) {
                    continue;
                }
                for (Parameter provider : required.parameters()) {
                    if (providers.contains(provider.name())) {
                        constraintOf(provider).ifPresent(r -> result.add(
                            new Requirement(provider.name(), r.constraint(), file.path(), r.line())));
                    }
                }
            }
        }
        for (Block provider : file.topLevel(BlockKind.PROVIDER)) {
            String name = provider.nameLabel().orElse("");
            if (providers.contains(name)) {
                provider.parameter("version").ifPresent(version -> result.add(
                    new Requirement(name, version.unquotedValue(), file.path(), version.line())));
            }
        }
        return result;
    }

    private static Optional<Requirement> constraintOf(Parameter provider) {
        for (Parameter entry : provider.entries()) {
            if ("version".equals(entry.name())) {
                return Optional.of(new Requirement(provider.name(), entry.unquotedValue(), null, entry.line()));
            }
        }
        String value = provider.value().trim();
        if (value.startsWith("\"")) {
            return Optional.of(new Requirement(provider.name(), provider.unquotedValue(), null, provider.line()));
        }
        Matcher matcher = INLINE_VERSION.matcher(value);
        if (matcher.find()) {
            return Optional.of(new Requirement(provider.name(), matcher.group(1), null, provider.line()));
        }
        return Optional.empty();
    }

    /**
     * One provider version constraint.
     *
     * @param provider provider name
     * @param constraint constraint text without quotes
     * @param file file holding the constraint
     * @param line line of the constraint
     */
    record Requirement(String provider, String constraint, Path file, int line) {
    }
}
