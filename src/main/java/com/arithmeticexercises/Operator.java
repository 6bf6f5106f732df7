package com.arithmeticexercises;

/**
 * The four binary operators. {@link #token()} is the raw form used by the parser,
 * {@link #glyph()} the form printed in exercises.
 */
public enum Operator {
    ADD('+', "+", 1, true, 'A'),
    SUBTRACT('-', "-", 1, false, 'S'),
    MULTIPLY('*', "×", 2, true, 'M'),
    DIVIDE('/', "÷", 2, false, 'D');

    private final char token;
    private final String glyph;
    private final int precedence;
    private final boolean commutative;
    private final char keyTag;

    Operator(char token, String glyph, int precedence, boolean commutative, char keyTag) {
        this.token = token;
        this.glyph = glyph;
        this.precedence = precedence;
        this.commutative = commutative;
        this.keyTag = keyTag;
    }

    public char token() { return token; }
    public String glyph() { return glyph; }
    public int precedence() { return precedence; }
    public boolean isCommutative() { return commutative; }
    char keyTag() { return keyTag; }

    /** @throws ArithmeticException on division by zero */
    public Fraction apply(Fraction left, Fraction right) {
        switch (this) {
            case ADD: return left.add(right);
            case SUBTRACT: return left.subtract(right);
            case MULTIPLY: return left.multiply(right);
            case DIVIDE: return left.divide(right);
            default: throw new IllegalStateException("Unknown operator: " + this);
        }
    }

    /**
     * Maps a raw token or display glyph to its operator, or {@code null} if the
     * text is not an operator.
     */
    public static Operator fromSymbol(String s) {
        switch (s) {
            case "+": return ADD;
            case "-":
            case "−": return SUBTRACT;
            case "*":
            case "×":
            case "x":
            case "X": return MULTIPLY;
            case "/":
            case "÷": return DIVIDE;
            default: return null;
        }
    }
}
