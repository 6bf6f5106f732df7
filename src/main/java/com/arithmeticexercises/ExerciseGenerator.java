package com.arithmeticexercises;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds batches of random exercises by rejection sampling.
 *
 * <p>Every subtraction keeps a non-negative result and every division yields a
 * proper fraction. Problems are deduplicated within a batch by
 * {@link Expr#canonicalKey()}, so {@code 1 + 2} and {@code 2 + 1} count once.
 * Each call to {@link #generate()} starts from an empty seen-set.
 */
public final class ExerciseGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(ExerciseGenerator.class);

    private static final Operator[] OPERATORS = Operator.values();

    private final GeneratorOptions options;

    public ExerciseGenerator(GeneratorOptions options) {
        this.options = options;
    }

    /**
     * Runs one batch. Returns fewer exercises than requested when the attempt
     * budget is exhausted; see {@link GenerationResult#isComplete()}.
     */
    public GenerationResult generate() {
        final long t0 = System.nanoTime();
        final Random random = options.seed != null ? new Random(options.seed) : new Random();
        final NumberSource numbers = new NumberSource(random);
        final GenerationStats stats = new GenerationStats(options.maxOperators);
        stats.range = options.range;
        stats.target = options.count;

        final Set<String> seen = new HashSet<>();
        final List<Exercise> accepted = new ArrayList<>(options.count);
        final long budget = options.attemptBudget();

        while (accepted.size() < options.count && stats.attempts < budget) {
            stats.attempts++;
            int ops = 1 + random.nextInt(options.maxOperators);
            Expr expr = build(ops, numbers, random);

            String key = expr.canonicalKey();
            if (seen.contains(key)) {
                stats.duplicates++;
                LOG.debug("duplicate: {}", key);
                continue;
            }
            Fraction value;
            try {
                value = expr.evaluate();
            } catch (ArithmeticException e) {
                stats.zeroDivisions++;
                LOG.warn("Discarding '{}': {}", expr.render(), e.getMessage());
                continue;
            }
            seen.add(key);
            accepted.add(new Exercise(expr, value));
            stats.recordAccepted(expr.opCount());
        }

        stats.elapsedMillis = (System.nanoTime() - t0) / 1_000_000L;
        GenerationResult result = new GenerationResult(accepted, stats, options.count);
        if (!result.isComplete()) {
            LOG.warn("Attempt budget of {} exhausted for range {}: generated {} of {} exercises",
                    budget, options.range, accepted.size(), options.count);
        }
        LOG.info("Generated {} exercises in {} attempts ({} duplicates, {} ms)",
                accepted.size(), stats.attempts, stats.duplicates, stats.elapsedMillis);
        return result;
    }

    /** Random expression with exactly {@code ops} operators, each satisfying the operator constraints or falling back to {@code +}. */
    Expr build(int ops, NumberSource numbers, Random random) {
        if (ops < 1) throw new IllegalArgumentException("ops must be >= 1");
        Expr node = firstPair(numbers, random);
        for (int i = 1; i < ops; i++) {
            node = attach(node, numbers, random);
        }
        return node;
    }

    private Expr firstPair(NumberSource numbers, Random random) {
        Expr left = leaf(numbers);
        Expr right = leaf(numbers);
        for (int attempt = 0; attempt < options.pairAttempts; attempt++) {
            Operator op = OPERATORS[random.nextInt(OPERATORS.length)];
            if (accepts(op, left.evaluate(), right.evaluate())) {
                return new BinaryOp(op, left, right);
            }
            left = leaf(numbers);
            right = leaf(numbers);
        }
        LOG.debug("no constrained operator for first pair, falling back to +");
        return new BinaryOp(Operator.ADD, left, right);
    }

    private Expr attach(Expr tree, NumberSource numbers, Random random) {
        Fraction treeValue = tree.evaluate();
        Expr leaf = leaf(numbers);
        for (int attempt = 0; attempt < options.attachAttempts; attempt++) {
            Operator op = OPERATORS[random.nextInt(OPERATORS.length)];
            Fraction leafValue = leaf.evaluate();
            if (op.isCommutative()) {
                return new BinaryOp(op, tree, leaf);
            }
            if (accepts(op, treeValue, leafValue)) {
                return new BinaryOp(op, tree, leaf);
            }
            if (accepts(op, leafValue, treeValue)) {
                return new BinaryOp(op, leaf, tree);
            }
            leaf = leaf(numbers);
        }
        LOG.debug("no constrained operator for '{}', falling back to +", tree.render());
        return new BinaryOp(Operator.ADD, tree, leaf);
    }

    private Expr leaf(NumberSource numbers) {
        return new Leaf(numbers.leafValue(options.range));
    }

    /** Whether {@code left op right} is allowed in an exercise. */
    static boolean accepts(Operator op, Fraction left, Fraction right) {
        switch (op) {
            case SUBTRACT: return left.compareTo(right) >= 0;
            case DIVIDE: {
                if (right.isZero()) return false;
                Fraction q = left.divide(right);
                return q.signum() > 0 && q.compareTo(Fraction.ONE) < 0;
            }
            default: return true;
        }
    }
}
