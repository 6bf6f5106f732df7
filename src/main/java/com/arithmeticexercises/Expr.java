package com.arithmeticexercises;

/**
 * Immutable arithmetic expression: either a {@link Leaf} or a {@link BinaryOp}.
 * Nodes are built once and never shared between parents.
 */
public interface Expr {

    /** @throws ArithmeticException if a divisor evaluates to zero */
    Fraction evaluate();

    /** Number of operator nodes in this subtree. */
    int opCount();

    /**
     * Structural signature used for deduplication. Swapping the operands of
     * {@code +} or {@code *} leaves it unchanged; for {@code -} and {@code /}
     * operand order is part of the key.
     */
    String canonicalKey();

    /** Infix text with display glyphs, tokens separated by single spaces. */
    String render();
}
