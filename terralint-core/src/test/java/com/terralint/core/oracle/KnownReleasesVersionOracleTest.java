package com.terralint.core.oracle;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link KnownReleasesVersionOracle}.
 */
class KnownReleasesVersionOracleTest {

    private static final Map<String, List<String>> RELEASES =
        Map.of("huaweicloud", List.of("1.62.0", "1.60.0", "1.61.0", "not-a-version"));

    @Test
    void isVersionValid_withoutWorkingFloor_checksReleaseExistence() throws OracleException {
        KnownReleasesVersionOracle oracle = new KnownReleasesVersionOracle(RELEASES, Map.of());

        assertThat(oracle.isVersionValid("huaweicloud", ">= 1.61.0")).isEqualTo(VersionVerdict.VALID);
        assertThat(oracle.isVersionValid("huaweicloud", ">= 1.63.0")).isEqualTo(VersionVerdict.UNRESOLVABLE);
    }

    @Test
    void isVersionValid_withWorkingFloor_comparesAgainstPreviousRelease() throws OracleException {
        KnownReleasesVersionOracle oracle =
            new KnownReleasesVersionOracle(RELEASES, Map.of("huaweicloud", "1.61.0"));

        assertThat(oracle.isVersionValid("huaweicloud", ">= 1.61.0")).isEqualTo(VersionVerdict.VALID);
        assertThat(oracle.isVersionValid("huaweicloud", ">= 1.62.0")).isEqualTo(VersionVerdict.TOO_PERMISSIVE);
        assertThat(oracle.isVersionValid("huaweicloud", ">= 1.60.0")).isEqualTo(VersionVerdict.TOO_RESTRICTIVE);
    }

    @Test
    void isVersionValid_withExactPinOfFirstRelease_isValid() throws OracleException {
        KnownReleasesVersionOracle oracle =
            new KnownReleasesVersionOracle(RELEASES, Map.of("huaweicloud", "1.60.0"));

        assertThat(oracle.isVersionValid("huaweicloud", "1.60.0")).isEqualTo(VersionVerdict.VALID);
    }

    @Test
    void isVersionValid_withUnknownProvider_throwsOracleException() {
        KnownReleasesVersionOracle oracle = new KnownReleasesVersionOracle(RELEASES, Map.of());

        assertThatThrownBy(() -> oracle.isVersionValid("aws", ">= 5.0.0"))
            .isInstanceOf(OracleException.class)
            .hasMessage("No known releases configured for provider 'aws'");
    }
}
