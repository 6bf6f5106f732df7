package com.arithmeticexercises;

/** Thrown when text is not an integer, {@code a/b} or {@code A’a/b} literal. */
public class FractionFormatException extends IllegalArgumentException {
    public FractionFormatException(String message) {
        super(message);
    }
}
