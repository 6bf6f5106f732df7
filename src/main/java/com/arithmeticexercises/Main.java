package com.arithmeticexercises;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static void usage() {
        System.err.println(
                "Usage:\n" +
                        "  arith-exercises -r <range> [-n <count>] [-seed N] [-stats] [-o <dir>]\n" +
                        "  arith-exercises -e <exercise-file> -a <answer-file> [-o <dir>]\n" +
                        "Options:\n" +
                        "  -r N          numbers are drawn below N (natural numbers and fractions)\n" +
                        "  -n N          number of exercises, 1.." + GeneratorOptions.MAX_COUNT + " [default 10]\n" +
                        "  -seed N       deterministic generation\n" +
                        "  -stats        also write " + ExerciseFiles.PERF + "\n" +
                        "  -e FILE       exercises to grade\n" +
                        "  -a FILE       answers to grade\n" +
                        "  -o DIR        output directory [default .]\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs one command and returns the process exit status. */
    public static int run(String[] args) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            System.err.println("Argument error: " + e.getMessage());
            return 2;
        }

        Path outDir = Paths.get(parsed.outputDir);
        try {
            if (parsed.mode == OptionsParser.Mode.GENERATE) {
                GenerationResult result = new ExerciseGenerator(parsed.generator).generate();
                List<Path> written = ExerciseFiles.writeBatch(result, outDir, parsed.generator.diagnostics);
                if (!result.isComplete()) {
                    System.out.printf("Only %d of %d distinct exercises fit range %d%n",
                            result.exercises().size(), result.requested(), parsed.generator.range);
                }
                for (Path p : written) System.out.println("Wrote " + p);
            } else {
                List<String> problems = ExerciseFiles.readLines(Paths.get(parsed.exercisePath));
                List<String> answers = ExerciseFiles.readLines(Paths.get(parsed.answerPath));
                GradeReport report = Grader.grade(problems, answers);
                Path grade = outDir.resolve(ExerciseFiles.GRADE);
                ExerciseFiles.writeLines(grade, report.toLines());
                for (String line : report.toLines()) System.out.println(line);
                System.out.println("Wrote " + grade);
            }
            return 0;
        } catch (FileNotFoundException e) {
            System.err.println("File not found: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("I/O error", e);
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }
}
