package com.arithmeticexercises;

import java.util.Objects;

public final class BinaryOp implements Expr {
    private final Operator op;
    private final Expr left;
    private final Expr right;

    public BinaryOp(Operator op, Expr left, Expr right) {
        this.op = Objects.requireNonNull(op, "op");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator operator() { return op; }
    public Expr left() { return left; }
    public Expr right() { return right; }

    @Override public Fraction evaluate() {
        return op.apply(left.evaluate(), right.evaluate());
    }

    @Override public int opCount() {
        return 1 + left.opCount() + right.opCount();
    }

    @Override public String canonicalKey() {
        String lk = left.canonicalKey();
        String rk = right.canonicalKey();
        if (op.isCommutative()) {
            if (lk.compareTo(rk) > 0) { String t = lk; lk = rk; rk = t; }
            return op.keyTag() + ":(" + lk + "," + rk + ")";
        }
        return op.keyTag() + ":[" + lk + "," + rk + "]";
    }

    @Override public String render() {
        return wrap(left, false) + " " + op.glyph() + " " + wrap(right, true);
    }

    /**
     * Parenthesizes a child of lower precedence, a child of a {@code -} or {@code /}
     * parent using the same operator, and any equal-precedence right operand of
     * {@code -} or {@code /}, so a left-associative reader gets the tree back.
     */
    private String wrap(Expr child, boolean rightOperand) {
        String s = child.render();
        if (!(child instanceof BinaryOp)) return s;
        Operator childOp = ((BinaryOp) child).op;
        boolean paren = childOp.precedence() < op.precedence()
                || (!op.isCommutative() && childOp == op)
                || (!op.isCommutative() && rightOperand && childOp.precedence() == op.precedence());
        return paren ? "( " + s + " )" : s;
    }

    @Override public String toString() { return render(); }
}
