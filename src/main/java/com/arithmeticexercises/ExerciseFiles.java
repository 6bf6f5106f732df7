package com.arithmeticexercises;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes the text artifacts: {@code Exercises.txt}, {@code Answers.txt},
 * {@code Grade.txt} and the optional {@code Perf.txt}. All files are UTF-8, one
 * entry per line.
 */
public final class ExerciseFiles {
    public static final String EXERCISES = "Exercises.txt";
    public static final String ANSWERS = "Answers.txt";
    public static final String GRADE = "Grade.txt";
    public static final String PERF = "Perf.txt";

    private ExerciseFiles() {}

    /** Writes problem lines to {@code out}, one per exercise. */
    public static void writeExercises(List<Exercise> exercises, PrintWriter out) {
        for (Exercise e : exercises) out.println(e.problemText());
    }

    /** Writes answer lines to {@code out}, aligned with {@link #writeExercises}. */
    public static void writeAnswers(List<Exercise> exercises, PrintWriter out) {
        for (Exercise e : exercises) out.println(e.answerText());
    }

    /**
     * Writes the exercise and answer files into {@code dir}, plus {@code Perf.txt}
     * when {@code withStats} is set. Returns the paths written.
     */
    public static List<Path> writeBatch(GenerationResult result, Path dir, boolean withStats) throws IOException {
        Path ex = dir.resolve(EXERCISES);
        Path ans = dir.resolve(ANSWERS);
        Path exTmp = staging(ex);
        Path ansTmp = staging(ans);
        try {
            try (PrintWriter pw = open(exTmp)) {
                writeExercises(result.exercises(), pw);
                checkWritten(pw, exTmp);
            }
            try (PrintWriter pw = open(ansTmp)) {
                writeAnswers(result.exercises(), pw);
                checkWritten(pw, ansTmp);
            }
            // both files are complete before either replaces its target
            moveIntoPlace(exTmp, ex);
            moveIntoPlace(ansTmp, ans);
        } finally {
            Files.deleteIfExists(exTmp);
            Files.deleteIfExists(ansTmp);
        }
        List<Path> written = new ArrayList<>();
        written.add(ex);
        written.add(ans);
        if (withStats) {
            Path perf = dir.resolve(PERF);
            writeLines(perf, result.stats().toLines());
            written.add(perf);
        }
        return written;
    }

    /**
     * Reads all lines of a grading input. Malformed UTF-8 is replaced, not rejected.
     *
     * @throws FileNotFoundException if the file is missing or unreadable
     */
    public static List<String> readLines(Path file) throws IOException {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new FileNotFoundException(file.toString());
        }
        // undecodable bytes become U+FFFD, so a damaged line is graded wrong instead of failing the run
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\R", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
        return lines;
    }

    public static void writeLines(Path file, List<String> lines) throws IOException {
        try (PrintWriter pw = open(file)) {
            for (String line : lines) pw.println(line);
            checkWritten(pw, file);
        }
    }

    private static Path staging(Path target) {
        return target.resolveSibling("." + target.getFileName() + ".tmp");
    }

    private static void moveIntoPlace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void checkWritten(PrintWriter pw, Path file) throws IOException {
        if (pw.checkError()) throw new IOException("Write failed: " + file);
    }

    // '\n' line ends regardless of platform
    private static PrintWriter open(Path file) throws IOException {
        Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new PrintWriter(w) {
            @Override public void println() { write('\n'); }
        };
    }
}
