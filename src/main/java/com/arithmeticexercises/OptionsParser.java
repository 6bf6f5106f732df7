package com.arithmeticexercises;

public final class OptionsParser {

    public enum Mode { GENERATE, GRADE }

    public static final class Parsed {
        public final Mode mode;
        public final GeneratorOptions generator;   // GENERATE only
        public final String exercisePath;          // GRADE only
        public final String answerPath;            // GRADE only
        public final String outputDir;
        private Parsed(Mode m, GeneratorOptions g, String e, String a, String o){
            mode=m; generator=g; exercisePath=e; answerPath=a; outputDir=o;
        }
    }

    public static Parsed parse(String[] args){
        GeneratorOptions.Builder b = GeneratorOptions.builder();
        Integer range = null;
        boolean countGiven = false;
        String exercise = null, answer = null, out = ".";

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-r": range = positive(a, value(args, ++i, a)); b.range(range); break;
                case "-n": {
                    int n = positive(a, value(args, ++i, a));
                    if (n > GeneratorOptions.MAX_COUNT)
                        throw new ConfigurationException("-n supports at most " + GeneratorOptions.MAX_COUNT + ", got " + n);
                    b.count(n);
                    countGiven = true;
                    break;
                }
                case "-seed": {
                    String v = value(args, ++i, a);
                    try {
                        b.seed(Long.parseLong(v));
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("-seed expects an integer, got '" + v + "'");
                    }
                    break;
                }
                case "-stats": b.diagnostics(true); break;
                case "-e": exercise = value(args, ++i, a); break;
                case "-a": answer = value(args, ++i, a); break;
                case "-o": out = value(args, ++i, a); break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + a);
            }
        }

        boolean grading = exercise != null || answer != null;
        if (grading) {
            if (range != null || countGiven)
                throw new IllegalArgumentException("-e/-a cannot be combined with -r/-n");
            if (exercise == null) throw new IllegalArgumentException("Missing -e <exercise-file>");
            if (answer == null) throw new IllegalArgumentException("Missing -a <answer-file>");
            return new Parsed(Mode.GRADE, null, exercise, answer, out);
        }
        if (range == null) throw new IllegalArgumentException("Missing -r <range>");
        return new Parsed(Mode.GENERATE, b.build(), null, null, out);
    }

    private static String value(String[] args, int i, String flag){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + flag);
        return args[i];
    }

    private static int positive(String flag, String s){
        int v;
        try {
            v = Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(flag + " expects a natural number, got '" + s + "'");
        }
        if (v < 1) throw new ConfigurationException(flag + " must be >= 1, got " + v);
        return v;
    }
}
