package com.arithmeticexercises;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grades submitted answers against problem text. Expected values are recomputed
 * from the problem lines with {@link ExpressionEvaluator}; nothing from generation
 * is reused.
 *
 * <p>Blank lines are dropped from both inputs before the remaining lines are
 * paired by position. A bad problem or answer line only makes that problem wrong.
 */
public final class Grader {
    private static final Logger LOG = LoggerFactory.getLogger(Grader.class);

    // "12. ", "12) ", "12:", "12、", "Q12: "
    private static final Pattern LABEL =
            Pattern.compile("^\\s*(?:[A-Za-z]+\\s*)?\\d+\\s*(?:[.)]\\s+|[:：、]\\s*)");

    private Grader() {}

    public static GradeReport grade(List<String> problemLines, List<String> answerLines) {
        List<String> problems = clean(problemLines);
        List<String> answers = clean(answerLines);

        List<GradeReport.Entry> entries = new ArrayList<>(problems.size());
        for (int i = 0; i < problems.size(); i++) {
            int index = i + 1;
            String submitted = i < answers.size() ? answers.get(i) : null;
            entries.add(gradeOne(index, problems.get(i), submitted));
        }
        if (answers.size() > problems.size()) {
            LOG.debug("Ignoring {} answers beyond the last problem", answers.size() - problems.size());
        }
        GradeReport report = new GradeReport(entries);
        LOG.info("Graded {} problems: {} correct", entries.size(), report.correctIndices().size());
        return report;
    }

    private static GradeReport.Entry gradeOne(int index, String problem, String submitted) {
        Fraction expected;
        try {
            expected = ExpressionEvaluator.evaluate(problem);
        } catch (ExpressionParseException | ArithmeticException e) {
            LOG.debug("Problem {} '{}' cannot be evaluated: {}", index, problem, e.getMessage());
            return new GradeReport.Entry(index, submitted, null, false, "problem: " + e.getMessage());
        }
        if (submitted == null) {
            return new GradeReport.Entry(index, null, expected, false, "no answer");
        }
        Fraction given;
        try {
            given = Fraction.parse(submitted);
        } catch (FractionFormatException e) {
            LOG.debug("Answer {} '{}' is not a number: {}", index, submitted, e.getMessage());
            return new GradeReport.Entry(index, submitted, expected, false, "answer: " + e.getMessage());
        }
        boolean ok = given.equals(expected);
        return new GradeReport.Entry(index, submitted, expected, ok, ok ? null : "expected " + expected.format());
    }

    /** Drops blank lines and strips numbering labels. */
    static List<String> clean(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            String t = line.replace("\uFEFF", "").trim();
            if (t.isEmpty()) continue;
            // a label with nothing after it still holds its position
            out.add(stripLabel(t));
        }
        return out;
    }

    static String stripLabel(String line) {
        return LABEL.matcher(line).replaceFirst("").trim();
    }
}
