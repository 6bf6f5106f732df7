package com.arithmeticexercises;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Random leaf values for exercises. The range bound {@code r} is exclusive: every
 * natural number and every whole part is drawn from {@code [0, r-1]}.
 */
public final class NumberSource {
    private final Random random;

    public NumberSource(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Uniform integer in {@code [0, r-1]}. */
    public Fraction natural(int r) {
        if (r < 1) throw new ConfigurationException("Range must be >= 1, got " + r);
        return Fraction.of(random.nextInt(r));
    }

    /**
     * Proper fraction with denominator in {@code [2, max(2, r-1)]} and numerator in
     * {@code [1, den-1]}, so the value lies strictly between 0 and 1.
     * Empty when {@code r < 2}: no such fraction fits the range.
     */
    public Optional<Fraction> properFraction(int r) {
        if (r < 2) return Optional.empty();
        int den = uniform(2, Math.max(2, r - 1));
        int num = uniform(1, den - 1);
        return Optional.of(new Fraction(BigInteger.valueOf(num), BigInteger.valueOf(den)));
    }

    /** Whole part in {@code [0, r-1]} plus an independent proper fraction; natural when {@code r < 2}. */
    public Fraction mixedFraction(int r) {
        Optional<Fraction> part = properFraction(r);
        if (!part.isPresent()) return natural(r);
        return natural(r).add(part.get());
    }

    /** One of natural, proper or mixed, chosen uniformly; always natural when {@code r < 2}. */
    public Fraction leafValue(int r) {
        if (r < 2) return natural(r);
        switch (random.nextInt(3)) {
            case 0: return natural(r);
            case 1: return properFraction(r).orElseGet(() -> natural(r));
            default: return mixedFraction(r);
        }
    }

    // inclusive on both ends
    private int uniform(int lo, int hi) {
        return lo + random.nextInt(hi - lo + 1);
    }
}
