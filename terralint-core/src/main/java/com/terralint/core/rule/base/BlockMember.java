package com.terralint.core.rule.base;

import com.terralint.core.model.Block;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.ParameterShape;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One member of a block body as seen by the spacing rules: a parameter or a nested block.
 *
 * @param name parameter name, or block keyword / dynamic label
 * @param kind spacing kind
 * @param startLine first line
 * @param endLine last line
 */
public record BlockMember(String name, Kind kind, int startLine, int endLine) {

    /**
     * Spacing kind of a member.
     */
    public enum Kind {
        /** Scalar {@code name = value}. */
        BASIC("basic parameter"),
        /** Meta-argument: count, for_each, provider, depends_on or a lifecycle block. */
        META("meta-argument"),
        /** {@code name = { ... }} or {@code name = [ ... ]}. */
        COLLECTION("collection parameter"),
        /** Nested structure block. */
        STRUCTURE("structure block"),
        /** {@code dynamic "name"} block. */
        DYNAMIC("dynamic block");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }

        public boolean isBlock() {
            return this == STRUCTURE || this == DYNAMIC;
        }
    }

    /**
     * Lists the members of a block body in source order. Inline parameters of single-line
     * blocks are not members.
     *
     * @param block containing block
     * @return members sorted by start line
     */
    public static List<BlockMember> of(Block block) {
        List<BlockMember> members = new ArrayList<>();
        for (Parameter parameter : block.parameters()) {
            if (parameter.inline()) {
                continue;
            }
            Kind kind;
            if (parameter.meta()) {
                kind = Kind.META;
            } else if (parameter.shape() == ParameterShape.COLLECTION_LITERAL) {
                kind = Kind.COLLECTION;
            } else {
                kind = Kind.BASIC;
            }
            members.add(new BlockMember(parameter.name(), kind, parameter.line(), parameter.endLine()));
        }
        for (Block child : block.children()) {
            Kind kind;
            if ("lifecycle".equals(child.keyword())) {
                kind = Kind.META;
            } else if ("dynamic".equals(child.keyword())) {
                kind = Kind.DYNAMIC;
            } else {
                kind = Kind.STRUCTURE;
            }
            members.add(new BlockMember(child.structureName(), kind, child.startLine(), child.endLine()));
        }
        members.sort(Comparator.comparingInt(BlockMember::startLine));
        return members;
    }

    /**
     * Returns true when two members belong to the same spacing group: the same kind, or
     * structure and dynamic blocks of the same name.
     *
     * @param other following member
     * @return true for same-group pairs
     */
    public boolean sameGroupAs(BlockMember other) {
        if (kind.isBlock() && other.kind.isBlock()) {
            return name.equals(other.name);
        }
        return kind == other.kind;
    }
}
