package com.ftlast.core.ast;

/**
 * Variant tag of an AST {@link Node}.
 *
 * <p>{@link #END} and {@link #ELSE} are parse-time markers. The parser consumes them
 * and they never appear in a finished tree.
 */
public enum NodeType {
    /** Plain text between markers */
    TEXT,
    /** {@code <#if>} directive */
    IF,
    /** Boolean constant */
    BOOL,
    /** Term followed by field accesses */
    CHAIN,
    /** Operator applied to operands, or a single wrapped operand */
    EXPRESSION,
    /** {@code <#else>} marker, never added to a tree */
    ELSE,
    /** {@code </#name>} marker, never added to a tree */
    END,
    /** Identifier reference */
    IDENTIFIER,
    /** Ordered sequence of nodes */
    CONTENT,
    /** Untyped nil constant */
    NIL,
    /** Numeric or character constant */
    NUMBER,
    /** {@code <#list>} directive */
    LIST,
    /** String constant */
    STRING,
    /** {@code <#include>} directive */
    INCLUDE,
    /** Loop variable bound by {@code <#list ... as name>} */
    VARIABLE;

    /**
     * Checks if this variant is a parse-time marker.
     *
     * @return true for {@link #END} and {@link #ELSE}
     */
    public boolean isMarker() {
        return this == END || this == ELSE;
    }
}
