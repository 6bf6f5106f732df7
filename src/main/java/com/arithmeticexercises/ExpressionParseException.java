package com.arithmeticexercises;

/**
 * Thrown when a problem line cannot be read back as an expression: an unknown
 * token, unbalanced parentheses, or operands and operators that do not reduce
 * to a single value.
 */
public class ExpressionParseException extends IllegalArgumentException {
    public ExpressionParseException(String message) {
        super(message);
    }

    public ExpressionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
