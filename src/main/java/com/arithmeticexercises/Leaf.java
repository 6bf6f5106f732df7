package com.arithmeticexercises;

import java.util.Objects;

public final class Leaf implements Expr {
    private final Fraction value;

    public Leaf(Fraction value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Fraction value() { return value; }

    @Override public Fraction evaluate() { return value; }

    @Override public int opCount() { return 0; }

    @Override public String canonicalKey() {
        return "N:" + value.numerator() + "/" + value.denominator();
    }

    @Override public String render() { return value.format(); }

    @Override public String toString() { return render(); }
}
