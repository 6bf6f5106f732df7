package com.arithmeticexercises;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class NumberSourceTest {

    private final NumberSource numbers = new NumberSource(new Random(42));

    @Test
    public void naturalStaysBelowRange() {
        for (int i = 0; i < 500; i++) {
            Fraction v = numbers.natural(5);
            assertTrue(v.isInteger());
            assertTrue(v.signum() >= 0 && v.compareTo(Fraction.of(5)) < 0, v.format());
        }
        assertEquals(Fraction.ZERO, numbers.natural(1));
    }

    @Test
    public void naturalRejectsEmptyRange() {
        assertThrows(ConfigurationException.class, () -> numbers.natural(0));
        assertThrows(ConfigurationException.class, () -> numbers.natural(-3));
    }

    @Test
    public void properFractionIsStrictlyBetweenZeroAndOne() {
        for (int r = 2; r <= 12; r++) {
            for (int i = 0; i < 100; i++) {
                Fraction f = numbers.properFraction(r).orElseThrow();
                assertTrue(f.signum() > 0 && f.compareTo(Fraction.ONE) < 0, f.format());
                assertTrue(f.denominator().intValue() <= Math.max(2, r - 1));
            }
        }
        assertEquals(Fraction.of(1, 2), numbers.properFraction(2).orElseThrow());
    }

    @Test
    public void properFractionIsEmptyBelowTwo() {
        assertEquals(Optional.empty(), numbers.properFraction(1));
        assertEquals(Optional.empty(), numbers.properFraction(0));
    }

    @Test
    public void mixedFractionHasWholeAndFractionalPart() {
        for (int i = 0; i < 200; i++) {
            Fraction m = numbers.mixedFraction(6);
            assertFalse(m.isInteger());
            assertTrue(m.signum() > 0 && m.compareTo(Fraction.of(6)) < 0, m.format());
        }
        assertEquals(Fraction.ZERO, numbers.mixedFraction(1));
    }

    @Test
    public void leafValuesCoverAllKinds() {
        boolean natural = false, proper = false, mixed = false;
        for (int i = 0; i < 300; i++) {
            Fraction v = numbers.leafValue(10);
            assertTrue(v.signum() >= 0 && v.compareTo(Fraction.of(10)) < 0);
            if (v.isInteger()) natural = true;
            else if (v.compareTo(Fraction.ONE) < 0) proper = true;
            else mixed = true;
        }
        assertTrue(natural && proper && mixed);
        for (int i = 0; i < 20; i++) assertEquals(Fraction.ZERO, numbers.leafValue(1));
    }
}
