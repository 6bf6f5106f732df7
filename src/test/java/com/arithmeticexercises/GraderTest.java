package com.arithmeticexercises;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class GraderTest {

    private static List<String> lines(String... s) { return Arrays.asList(s); }

    @Test
    public void singleCorrectAnswer() {
        GradeReport r = Grader.grade(lines("3 + 4 ="), lines("7"));
        assertEquals(lines("Correct: 1 (1)", "Wrong: 0 ()"), r.toLines());
    }

    @Test
    public void emptyInputs() {
        GradeReport r = Grader.grade(Collections.emptyList(), Collections.emptyList());
        assertEquals(lines("Correct: 0 ()", "Wrong: 0 ()"), r.toLines());
    }

    @Test
    public void constraintViolatingProblemStillGrades() {
        GradeReport r = Grader.grade(lines("5 - 8 =", "5 - 8 ="), lines("-3", "3"));
        assertEquals(Fraction.of(-3), r.entries().get(0).expected);
        assertEquals(lines("Correct: 1 (1)", "Wrong: 1 (2)"), r.toLines());
    }

    @Test
    public void mixedVerdictsListIndicesAscending() {
        GradeReport r = Grader.grade(
                lines("1 + 1 =", "1/2 × 4 =", "( 1 + 2 ) ÷ 4 =", "2’1/2 - 1/2 =", "3 ÷ 4 ="),
                lines("2", "3", "3/4", "2", "6/8"));
        assertEquals(Arrays.asList(1, 3, 4, 5), r.correctIndices());
        assertEquals(Arrays.asList(2), r.wrongIndices());
        assertEquals(lines("Correct: 4 (1, 3, 4, 5)", "Wrong: 1 (2)"), r.toLines());
    }

    @Test
    public void badLinesOnlyFailThemselves() {
        GradeReport r = Grader.grade(
                lines("1 + 1 =", "1 ÷ 0 =", "( 2 + 3 =", "2 + 2 ="),
                lines("2", "0", "5", "four"));
        assertEquals(lines("Correct: 1 (1)", "Wrong: 3 (2, 3, 4)"), r.toLines());
        assertNull(r.entries().get(1).expected);
        assertEquals(Fraction.of(4), r.entries().get(3).expected);
        assertNotNull(r.entries().get(3).reason);
    }

    @Test
    public void missingAnswersAreWrongAndExtraAnswersIgnored() {
        GradeReport r = Grader.grade(lines("1 + 1 =", "2 + 2 ="), lines("2"));
        assertEquals(lines("Correct: 1 (1)", "Wrong: 1 (2)"), r.toLines());
        assertNull(r.entries().get(1).submitted);

        r = Grader.grade(lines("1 + 1 ="), lines("2", "4", "6"));
        assertEquals(lines("Correct: 1 (1)", "Wrong: 0 ()"), r.toLines());
    }

    @Test
    public void blankLinesAndLabelsAreSkipped() {
        GradeReport r = Grader.grade(
                lines("1. 3 + 4 =", "", "2. 1/2 + 1/2 =", "   ", "Q3: 2 × 3 ="),
                lines("1: 7", "", "2、1", "3) 5"));
        assertEquals(lines("Correct: 2 (1, 2)", "Wrong: 1 (3)"), r.toLines());
    }

    @Test
    public void stripsLabelsButNotNumbers() {
        assertEquals("3 + 4 =", Grader.stripLabel("3 + 4 ="));
        assertEquals("3 + 4 =", Grader.stripLabel("12. 3 + 4 ="));
        assertEquals("2’1/2", Grader.stripLabel("Answer 4: 2’1/2"));
        assertEquals("3/4", Grader.stripLabel("3/4"));
        assertEquals("1’1/2", Grader.stripLabel("1’1/2"));
    }
}
