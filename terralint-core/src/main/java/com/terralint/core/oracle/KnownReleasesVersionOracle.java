package com.terralint.core.oracle;

import com.terralint.core.util.SemanticVersion;
import com.terralint.core.util.VersionConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Offline oracle backed by a configured list of known releases per provider and, optionally,
 * the lowest release known to work.
 *
 * <p>Verdicts, in order:</p>
 * <ol>
 *   <li>{@link VersionVerdict#UNRESOLVABLE} when the declared minimum is not a known release</li>
 *   <li>{@link VersionVerdict#TOO_RESTRICTIVE} when no known release satisfies the constraint,
 *       or the declared minimum is below the lowest working release</li>
 *   <li>{@link VersionVerdict#TOO_PERMISSIVE} when the release before the declared minimum is
 *       itself at or above the lowest working release</li>
 *   <li>{@link VersionVerdict#VALID} otherwise</li>
 * </ol>
 */
public class KnownReleasesVersionOracle implements ProviderVersionOracle {

    private static final Logger log = LoggerFactory.getLogger(KnownReleasesVersionOracle.class);

    private final Map<String, List<String>> knownReleases;
    private final Map<String, String> minimumWorking;

    /**
     * @param knownReleases released versions per provider
     * @param minimumWorking lowest working release per provider; providers without an entry
     *        are only checked for release existence
     */
    public KnownReleasesVersionOracle(Map<String, List<String>> knownReleases, Map<String, String> minimumWorking) {
        this.knownReleases = Map.copyOf(knownReleases);
        this.minimumWorking = Map.copyOf(minimumWorking);
    }

    @Override
    public VersionVerdict isVersionValid(String provider, String declaredConstraint) throws OracleException {
        List<SemanticVersion> releases = knownReleases.getOrDefault(provider, List.of()).stream()
            .map(SemanticVersion::parse)
            .flatMap(Optional::stream)
            .sorted()
            .toList();
        if (releases.isEmpty()) {
            throw new OracleException("No known releases configured for provider '" + provider + "'");
        }

        Optional<SemanticVersion> minimum = VersionConstraints.minimumVersion(declaredConstraint);
        if (minimum.isEmpty() || !releases.contains(minimum.get())) {
            return VersionVerdict.UNRESOLVABLE;
        }

        boolean satisfiable;
        try {
            satisfiable = releases.stream().anyMatch(v -> VersionConstraints.isSatisfiedBy(v, declaredConstraint));
        } catch (IllegalArgumentException e) {
            throw new OracleException("Cannot evaluate constraint '" + declaredConstraint + "': " + e.getMessage(), e);
        }
        if (!satisfiable) {
            return VersionVerdict.TOO_RESTRICTIVE;
        }

        Optional<SemanticVersion> floor = SemanticVersion.parse(minimumWorking.get(provider));
        if (floor.isEmpty()) {
            return VersionVerdict.VALID;
        }
        if (floor.get().compareTo(minimum.get()) > 0) {
            return VersionVerdict.TOO_RESTRICTIVE;
        }
        int index = releases.indexOf(minimum.get());
        if (index > 0 && releases.get(index - 1).isAtLeast(floor.get())) {
            log.debug("Release {} of {} also works below declared minimum {}", releases.get(index - 1), provider, minimum.get());
            return VersionVerdict.TOO_PERMISSIVE;
        }
        return VersionVerdict.VALID;
    }
}
