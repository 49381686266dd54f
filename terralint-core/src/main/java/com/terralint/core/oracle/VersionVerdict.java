package com.terralint.core.oracle;

/**
 * Verdict of a {@link ProviderVersionOracle} on a declared provider version constraint.
 *
 * @since 1.0.0
 */
public enum VersionVerdict {
    /** The declared minimum is the lowest release that works. */
    VALID,
    /** An earlier release also works, so the declared minimum is higher than needed. */
    TOO_PERMISSIVE,
    /** The declared minimum does not work with the configuration. */
    TOO_RESTRICTIVE,
    /** The declared minimum is not a published release. */
    UNRESOLVABLE
}
