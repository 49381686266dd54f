package com.terralint.core.model;

import java.util.Map;

/**
 * Kind of a brace-delimited block.
 *
 * @since 1.0.0
 */
public enum BlockKind {
    /** Synthetic root owning the top-level blocks and parameters of a file. */
    ROOT,
    /** {@code resource "type" "name" { ... }} */
    RESOURCE,
    /** {@code data "type" "name" { ... }} */
    DATA,
    /** {@code variable "name" { ... }} */
    VARIABLE,
    /** {@code output "name" { ... }} */
    OUTPUT,
    /** {@code locals { ... }} */
    LOCALS,
    /** {@code terraform { ... }} */
    TERRAFORM,
    /** {@code provider "name" { ... }} */
    PROVIDER,
    /** {@code module "name" { ... }} */
    MODULE,
    /** {@code dynamic "name" { ... }} inside another block. */
    DYNAMIC,
    /** Any other block nested inside a block, e.g. {@code lifecycle}, {@code ingress}, {@code content}. */
    NESTED_STRUCTURE,
    /** Other top-level blocks such as {@code moved}, {@code import}, {@code check} or {@code removed}. */
    OTHER;

    private static final Map<String, BlockKind> TOP_LEVEL = Map.of(
        "resource", RESOURCE,
        "data", DATA,
        "variable", VARIABLE,
        "output", OUTPUT,
        "locals", LOCALS,
        "terraform", TERRAFORM,
        "provider", PROVIDER,
        "module", MODULE
    );

    /**
     * Resolves the kind of a block from its keyword and nesting depth.
     *
     * @param keyword header keyword
     * @param depth depth of the new block (1 for top-level blocks)
     * @return block kind
     */
    public static BlockKind of(String keyword, int depth) {
        if (depth <= 1) {
            return TOP_LEVEL.getOrDefault(keyword, OTHER);
        }
        return "dynamic".equals(keyword) ? DYNAMIC : NESTED_STRUCTURE;
    }

    /**
     * Returns true for blocks whose first label is a type and second label an instance name.
     *
     * @return true for resource and data blocks
     */
    public boolean hasTypeLabel() {
        return this == RESOURCE || this == DATA;
    }
}
