package com.arithmeticexercises;

import java.util.Objects;

/** One accepted problem and its exact answer. */
public final class Exercise {
    private final Expr expression;
    private final Fraction answer;

    public Exercise(Expr expression, Fraction answer) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.answer = Objects.requireNonNull(answer, "answer");
    }

    public Expr expression() { return expression; }
    public Fraction answer() { return answer; }

    /** Line written to the exercise file, e.g. {@code 1/2 + 3 =}. */
    public String problemText() { return expression.render() + " ="; }

    /** Line written to the answer file. */
    public String answerText() { return answer.format(); }

    @Override public String toString() { return problemText() + " " + answerText(); }
}
