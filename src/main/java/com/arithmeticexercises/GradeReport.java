package com.arithmeticexercises;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** Per-problem verdicts of one grading run and the two-line summary. */
public final class GradeReport {

    /** Verdict for one problem. {@code expected} is null when the problem itself could not be evaluated. */
    public static final class Entry {
        public final int index;             // 1-based
        public final String submitted;      // null when the answer file is shorter
        public final Fraction expected;
        public final boolean correct;
        public final String reason;         // why it is wrong, null when correct

        Entry(int index, String submitted, Fraction expected, boolean correct, String reason) {
            this.index = index;
            this.submitted = submitted;
            this.expected = expected;
            this.correct = correct;
            this.reason = reason;
        }
    }

    private final List<Entry> entries;

    GradeReport(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> entries() { return entries; }

    public List<Integer> correctIndices() {
        return entries.stream().filter(e -> e.correct).map(e -> e.index).collect(Collectors.toList());
    }

    public List<Integer> wrongIndices() {
        return entries.stream().filter(e -> !e.correct).map(e -> e.index).collect(Collectors.toList());
    }

    /** {@code Correct: 2 (1, 3)} and {@code Wrong: 1 (2)}. */
    public List<String> toLines() {
        List<String> out = new ArrayList<>(2);
        out.add(line("Correct", correctIndices()));
        out.add(line("Wrong", wrongIndices()));
        return out;
    }

    private static String line(String label, List<Integer> indices) {
        String joined = indices.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return label + ": " + indices.size() + " (" + joined + ")";
    }

    @Override
    public String toString() {
        return String.join(System.lineSeparator(), toLines());
    }
}
