package com.arithmeticexercises;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads a printed problem back into a value, independently of the tree that
 * produced it: whitespace tokenization, shunting-yard conversion to postfix,
 * then stack evaluation in exact arithmetic.
 *
 * <p>Operators use the same precedence as {@link BinaryOp#render()} and are
 * left-associative. No generation constraint is checked here; {@code 5 - 8}
 * evaluates to {@code -3}.
 */
public final class ExpressionEvaluator {

    static final String OPEN = "(";
    static final String CLOSE = ")";

    private ExpressionEvaluator() {}

    /**
     * Evaluates a problem line. Anything from the first {@code =} on is ignored.
     *
     * @throws ExpressionParseException on a malformed line
     * @throws ArithmeticException on a zero divisor
     */
    public static Fraction evaluate(String problem) {
        return evaluatePostfix(toPostfix(tokenize(problem)));
    }

    /**
     * Splits on whitespace and normalizes display glyphs to {@code + - * /}.
     * Each remaining token is an operator, a parenthesis or a number literal.
     */
    public static List<String> tokenize(String problem) {
        if (problem == null) throw new ExpressionParseException("null problem");
        String body = problem;
        int eq = body.indexOf('=');
        if (eq >= 0) body = body.substring(0, eq);
        body = body.trim();
        if (body.isEmpty()) throw new ExpressionParseException("Empty expression");

        List<String> tokens = new ArrayList<>();
        for (String raw : body.split("\\s+")) {
            Operator op = Operator.fromSymbol(raw);
            if (op != null) {
                tokens.add(String.valueOf(op.token()));
            } else if (raw.equals(OPEN) || raw.equals("（")) {
                tokens.add(OPEN);
            } else if (raw.equals(CLOSE) || raw.equals("）")) {
                tokens.add(CLOSE);
            } else {
                try {
                    Fraction.parse(raw);
                } catch (FractionFormatException e) {
                    throw new ExpressionParseException("Bad token '" + raw + "'", e);
                }
                tokens.add(raw);
            }
        }
        return tokens;
    }

    /** Shunting-yard: infix tokens to postfix order. */
    public static List<String> toPostfix(List<String> tokens) {
        List<String> output = new ArrayList<>(tokens.size());
        Deque<String> ops = new ArrayDeque<>();
        boolean expectOperand = true;

        for (String tk : tokens) {
            if (tk.equals(OPEN)) {
                if (!expectOperand) throw new ExpressionParseException("Unexpected '('");
                ops.push(tk);
                continue;
            }
            if (tk.equals(CLOSE)) {
                if (expectOperand) throw new ExpressionParseException("Unexpected ')'");
                while (!ops.isEmpty() && !ops.peek().equals(OPEN)) output.add(ops.pop());
                if (ops.isEmpty()) throw new ExpressionParseException("Unbalanced ')'");
                ops.pop();
                continue;
            }
            Operator op = operator(tk);
            if (op != null) {
                if (expectOperand) throw new ExpressionParseException("Missing operand before '" + tk + "'");
                while (!ops.isEmpty() && !ops.peek().equals(OPEN)
                        && operator(ops.peek()).precedence() >= op.precedence()) {
                    output.add(ops.pop());
                }
                ops.push(tk);
                expectOperand = true;
                continue;
            }
            if (!expectOperand) throw new ExpressionParseException("Missing operator before '" + tk + "'");
            output.add(tk);
            expectOperand = false;
        }
        if (expectOperand) throw new ExpressionParseException("Expression ends without an operand");
        while (!ops.isEmpty()) {
            String o = ops.pop();
            if (o.equals(OPEN)) throw new ExpressionParseException("Unbalanced '('");
            output.add(o);
        }
        return output;
    }

    /**
     * Evaluates postfix tokens.
     *
     * @throws ExpressionParseException if the tokens do not reduce to exactly one value
     * @throws ArithmeticException on a zero divisor
     */
    public static Fraction evaluatePostfix(List<String> postfix) {
        Deque<Fraction> stack = new ArrayDeque<>();
        for (String tk : postfix) {
            Operator op = operator(tk);
            if (op == null) {
                try {
                    stack.push(Fraction.parse(tk));
                } catch (FractionFormatException e) {
                    throw new ExpressionParseException("Bad operand '" + tk + "'", e);
                }
                continue;
            }
            if (stack.size() < 2) throw new ExpressionParseException("Operator '" + tk + "' lacks operands");
            Fraction b = stack.pop();
            Fraction a = stack.pop();
            stack.push(op.apply(a, b));
        }
        if (stack.size() != 1) {
            throw new ExpressionParseException("Expected one result, found " + stack.size());
        }
        return stack.pop();
    }

    // raw operator tokens only; "-3" is a literal
    private static Operator operator(String tk) {
        if (tk.length() != 1) return null;
        switch (tk.charAt(0)) {
            case '+': return Operator.ADD;
            case '-': return Operator.SUBTRACT;
            case '*': return Operator.MULTIPLY;
            case '/': return Operator.DIVIDE;
            default: return null;
        }
    }
}
