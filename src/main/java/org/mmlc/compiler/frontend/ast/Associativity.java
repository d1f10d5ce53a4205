package org.mmlc.compiler.frontend.ast;

/**
 * Grouping direction of operators with equal precedence.
 */
public enum Associativity {
    /** {@code a - b - c} groups as {@code (a - b) - c}. */
    LEFT,
    /** {@code a :: b :: c} groups as {@code a :: (b :: c)}. */
    RIGHT
}
