package com.arithmeticexercises;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable arbitrary-precision rational with normalized sign and gcd reduction.
 *
 * <p>Text form is the exercise notation: integers print as {@code A}, values strictly
 * between -1 and 1 as {@code a/b}, everything else as a mixed number {@code A’a/b}.
 */
public final class Fraction implements Comparable<Fraction> {
    public static final Fraction ZERO = new Fraction(BigInteger.ZERO, BigInteger.ONE);
    public static final Fraction ONE  = new Fraction(BigInteger.ONE,  BigInteger.ONE);

    /** Separator between the whole part and the fractional part of a mixed number (U+2019). */
    public static final char MIXED_SEPARATOR = '’';
    /** Accepted on input in place of {@link #MIXED_SEPARATOR}. */
    public static final char ASCII_MIXED_SEPARATOR = '\'';

    private static final Pattern INTEGER = Pattern.compile("(\\d+)");
    private static final Pattern PROPER  = Pattern.compile("(\\d+)/(\\d+)");
    private static final Pattern MIXED   = Pattern.compile("(\\d+)[" + MIXED_SEPARATOR + ASCII_MIXED_SEPARATOR + "](\\d+)/(\\d+)");

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public Fraction(BigInteger num, BigInteger den) {
        Objects.requireNonNull(num, "numerator");
        Objects.requireNonNull(den, "denominator");
        if (den.signum() == 0) throw new ArithmeticException("Zero denominator");
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        BigInteger g = num.gcd(den);
        this.n = num.divide(g);
        this.d = den.divide(g);
    }

    public Fraction(BigInteger integer) { this(integer, BigInteger.ONE); }

    /** Factories */
    public static Fraction of(long k) { return new Fraction(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Fraction of(long num, long den) { return new Fraction(BigInteger.valueOf(num), BigInteger.valueOf(den)); }

    /**
     * Parses the exercise notation: an optional leading {@code -}, then an integer
     * {@code A}, a fraction {@code a/b} or a mixed number {@code A’a/b} (an ASCII
     * apostrophe is accepted as separator). Surrounding whitespace is ignored.
     *
     * @throws FractionFormatException if the text has none of these shapes or a
     *         denominator is zero
     */
    public static Fraction parse(String s) {
        if (s == null) throw new FractionFormatException("null literal");
        String t = s.trim();
        boolean negative = false;
        if (t.startsWith("-")) {
            negative = true;
            t = t.substring(1);
        }
        if (t.isEmpty()) throw new FractionFormatException("Empty literal: '" + s + "'");

        Fraction value;
        Matcher m;
        if ((m = INTEGER.matcher(t)).matches()) {
            value = new Fraction(new BigInteger(m.group(1)));
        } else if ((m = PROPER.matcher(t)).matches()) {
            value = ratio(new BigInteger(m.group(1)), new BigInteger(m.group(2)), s);
        } else if ((m = MIXED.matcher(t)).matches()) {
            Fraction whole = new Fraction(new BigInteger(m.group(1)));
            value = whole.add(ratio(new BigInteger(m.group(2)), new BigInteger(m.group(3)), s));
        } else {
            throw new FractionFormatException("Not a number literal: '" + s + "'");
        }
        return negative ? value.negate() : value;
    }

    private static Fraction ratio(BigInteger num, BigInteger den, String source) {
        if (den.signum() == 0) throw new FractionFormatException("Zero denominator in '" + source + "'");
        return new Fraction(num, den);
    }

    public BigInteger numerator()   { return n; }
    public BigInteger denominator() { return d; }

    public boolean isInteger() { return d.equals(BigInteger.ONE); }

    // ---- arithmetic ----

    public Fraction add(Fraction o) {
        if (d.equals(o.d)) return new Fraction(n.add(o.n), d);
        return new Fraction(n.multiply(o.d).add(o.n.multiply(d)), d.multiply(o.d));
    }

    public Fraction subtract(Fraction o) {
        return add(o.negate());
    }

    public Fraction multiply(Fraction o) {
        // (n/d)*(x/y) with cross-cancel
        BigInteger g1 = n.gcd(o.d);
        BigInteger g2 = d.gcd(o.n);
        BigInteger a = n.divide(g1);
        BigInteger b = o.n.divide(g2);
        BigInteger c = d.divide(g2);
        BigInteger e = o.d.divide(g1);
        return new Fraction(a.multiply(b), c.multiply(e));
    }

    public Fraction divide(Fraction o) {
        if (o.n.signum() == 0) throw new ArithmeticException("Division by zero");
        return multiply(o.inverse());
    }

    public Fraction inverse() {
        if (n.signum() == 0) throw new ArithmeticException("Zero has no inverse");
        return new Fraction(d, n);
    }

    public Fraction negate() { return n.signum() == 0 ? ZERO : new Fraction(n.negate(), d); }
    public int signum()      { return n.signum(); }
    public boolean isZero()  { return n.signum() == 0; }

    // ---- Comparable ----
    @Override public int compareTo(Fraction o) {
        // a/b ? c/d  <=>  ad ? cb
        return n.multiply(o.d).compareTo(o.n.multiply(d));
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fraction)) return false;
        Fraction o = (Fraction) obj;
        return n.equals(o.n) && d.equals(o.d);
    }

    @Override public int hashCode() { return n.hashCode() * 31 + d.hashCode(); }

    /** Exercise notation; {@link #parse(String)} reads it back to an equal value. */
    public String format() {
        if (isInteger()) return n.toString();
        String sign = n.signum() < 0 ? "-" : "";
        BigInteger an = n.abs();
        if (an.compareTo(d) < 0) return sign + an + "/" + d;
        BigInteger[] qr = an.divideAndRemainder(d);
        return sign + qr[0] + MIXED_SEPARATOR + qr[1] + "/" + d;
    }

    @Override public String toString() { return format(); }
}
