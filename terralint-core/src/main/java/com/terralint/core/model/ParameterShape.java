package com.terralint.core.model;

/**
 * Syntactic shape of a block member.
 *
 * @since 1.0.0
 */
public enum ParameterShape {
    /** {@code name = value} with a scalar or expression value (including heredocs). */
    SCALAR,
    /** {@code name = { ... }} or {@code name = [ ... ]}. */
    COLLECTION_LITERAL,
    /** {@code name { ... }} nested block. */
    NESTED_BLOCK,
    /** {@code dynamic "name" { ... }} block. */
    DYNAMIC_BLOCK
}
