package com.terralint.core.oracle;

/**
 * Supplies validity verdicts on provider version constraints.
 *
 * <p>The provider minimum version rule calls this interface and only interprets the verdict.
 * Implementations backed by a release feed or a validation run live outside the core.</p>
 */
public interface ProviderVersionOracle {

    /**
     * Judges a declared version constraint.
     *
     * @param provider provider name, e.g. {@code huaweicloud}
     * @param declaredConstraint constraint text from {@code required_providers}
     * @return verdict
     * @throws OracleException if no verdict can be produced
     */
    VersionVerdict isVersionValid(String provider, String declaredConstraint) throws OracleException;
}
