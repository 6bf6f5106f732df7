package com.arithmeticexercises;

/** Immutable settings for one generation batch. */
public final class GeneratorOptions {
    public static final int MAX_COUNT = 10000;

    public final int range;                 // exclusive upper bound on leaf values
    public final int count;                 // problems requested
    public final Long seed;                 // null = nondeterministic
    public final boolean diagnostics;       // collect and write Perf.txt
    public final int attemptsPerProblem;    // batch budget = count * attemptsPerProblem
    public final int pairAttempts;          // retries for the first operator
    public final int attachAttempts;        // retries per additional operator
    public final int maxOperators;          // operators per problem drawn from [1, maxOperators]

    private GeneratorOptions(Builder b) {
        this.range = b.range;
        this.count = b.count;
        this.seed = b.seed;
        this.diagnostics = b.diagnostics;
        this.attemptsPerProblem = b.attemptsPerProblem;
        this.pairAttempts = b.pairAttempts;
        this.attachAttempts = b.attachAttempts;
        this.maxOperators = b.maxOperators;
    }

    public static Builder builder() { return new Builder(); }

    public long attemptBudget() { return (long) count * attemptsPerProblem; }

    public static final class Builder {
        private int range = 10, count = 10;
        private Long seed;
        private boolean diagnostics;
        private int attemptsPerProblem = 200, pairAttempts = 100, attachAttempts = 50;
        private int maxOperators = 3;

        public Builder range(int v){ this.range=v; return this; }
        public Builder count(int v){ this.count=v; return this; }
        public Builder seed(long v){ this.seed=v; return this; }
        public Builder diagnostics(boolean v){ this.diagnostics=v; return this; }
        public Builder attemptsPerProblem(int v){ this.attemptsPerProblem=v; return this; }
        public Builder pairAttempts(int v){ this.pairAttempts=v; return this; }
        public Builder attachAttempts(int v){ this.attachAttempts=v; return this; }
        public Builder maxOperators(int v){ this.maxOperators=v; return this; }

        /** @throws ConfigurationException if a bound or count is out of range */
        public GeneratorOptions build(){
            if (range < 1) throw new ConfigurationException("Range must be >= 1, got " + range);
            if (count < 1) throw new ConfigurationException("Count must be >= 1, got " + count);
            if (attemptsPerProblem < 1 || pairAttempts < 1 || attachAttempts < 1)
                throw new ConfigurationException("Attempt limits must be >= 1");
            if (maxOperators < 1) throw new ConfigurationException("Operator limit must be >= 1, got " + maxOperators);
            return new GeneratorOptions(this);
        }
    }
}
