package com.arithmeticexercises;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class ExerciseGeneratorTest {

    private static GenerationResult generate(int r, int n, long seed) {
        return new ExerciseGenerator(GeneratorOptions.builder().range(r).count(n).seed(seed).build()).generate();
    }

    /** Checks the subtraction and division constraints on every node. */
    private static void assertConstrained(Expr e) {
        if (!(e instanceof BinaryOp)) return;
        BinaryOp b = (BinaryOp) e;
        Fraction l = b.left().evaluate();
        Fraction r = b.right().evaluate();
        if (b.operator() == Operator.SUBTRACT) {
            assertTrue(l.compareTo(r) >= 0, e.render());
        } else if (b.operator() == Operator.DIVIDE) {
            Fraction q = l.divide(r);
            assertTrue(q.signum() > 0 && q.compareTo(Fraction.ONE) < 0, e.render());
        }
        assertConstrained(b.left());
        assertConstrained(b.right());
    }

    @Test
    public void smallBatchScenario() {
        GenerationResult res = generate(10, 5, 1L);
        assertTrue(res.isComplete());
        List<Exercise> ex = res.exercises();
        assertEquals(5, ex.size());
        Set<String> keys = new HashSet<>();
        for (Exercise e : ex) {
            int ops = e.expression().opCount();
            assertTrue(ops >= 1 && ops <= 3, e.problemText());
            assertTrue(keys.add(e.expression().canonicalKey()), "duplicate " + e.problemText());
            assertTrue(e.problemText().endsWith(" ="));
            assertEquals(e.answerText(), Fraction.parse(e.answerText()).format());
        }
    }

    @Test
    public void acceptedTreesRespectConstraintsAndAreUnique() {
        for (long seed = 0; seed < 5; seed++) {
            GenerationResult res = generate(20, 400, seed);
            assertEquals(400, res.exercises().size());
            Set<String> keys = res.exercises().stream()
                    .map(e -> e.expression().canonicalKey()).collect(Collectors.toSet());
            assertEquals(400, keys.size());
            for (Exercise e : res.exercises()) {
                assertConstrained(e.expression());
                assertTrue(e.answer().signum() >= 0, e.toString());
            }
        }
    }

    @Test
    public void printedProblemsReadBackToTheirAnswers() {
        for (long seed = 10; seed < 15; seed++) {
            for (Exercise e : generate(15, 300, seed).exercises()) {
                assertEquals(e.answer(), ExpressionEvaluator.evaluate(e.problemText()), e.problemText());
                assertEquals(e.answer(), Fraction.parse(e.answerText()));
            }
        }
    }

    @Test
    public void statsAddUp() {
        GenerationResult res = generate(10, 100, 3L);
        GenerationStats st = res.stats();
        assertEquals(10, st.range);
        assertEquals(100, st.target);
        assertEquals(100, st.generated);
        assertEquals(st.attempts, st.generated + st.duplicates + st.zeroDivisions);
        assertEquals(100, st.withOperators(1) + st.withOperators(2) + st.withOperators(3));
        assertEquals(0, st.zeroDivisions);
        List<String> lines = st.toLines();
        assertEquals("Range r: 10", lines.get(0));
        assertEquals("Generated: 100", lines.get(2));
        assertTrue(lines.get(6).startsWith("Op count distribution: 1->"));
        assertTrue(lines.get(7).matches("Time: \\d+ ms"));
    }

    @Test
    public void tinyRangeReturnsPartialBatch() {
        GenerationResult res = generate(1, 200, 5L);
        assertFalse(res.isComplete());
        assertTrue(res.exercises().size() > 0 && res.exercises().size() < 200);
        assertEquals(200L * 200, res.stats().attempts);
        for (Exercise e : res.exercises()) {
            assertEquals(Fraction.ZERO, e.answer());
            assertFalse(e.problemText().contains("÷"), e.problemText());
        }
    }

    @Test
    public void sameSeedSameBatch() {
        List<String> a = generate(12, 50, 99L).exercises().stream().map(Exercise::problemText).collect(Collectors.toList());
        List<String> b = generate(12, 50, 99L).exercises().stream().map(Exercise::problemText).collect(Collectors.toList());
        assertEquals(a, b);
    }

    @Test
    public void buildHonoursOperatorCount() {
        ExerciseGenerator gen = new ExerciseGenerator(GeneratorOptions.builder().range(8).build());
        Random random = new Random(4);
        NumberSource numbers = new NumberSource(random);
        for (int ops = 1; ops <= 3; ops++) {
            for (int i = 0; i < 100; i++) {
                assertEquals(ops, gen.build(ops, numbers, random).opCount());
            }
        }
        assertThrows(IllegalArgumentException.class, () -> gen.build(0, numbers, random));
    }

    @Test
    public void acceptanceRules() {
        assertTrue(ExerciseGenerator.accepts(Operator.SUBTRACT, Fraction.of(3), Fraction.of(3)));
        assertFalse(ExerciseGenerator.accepts(Operator.SUBTRACT, Fraction.of(1, 2), Fraction.of(2, 3)));
        assertTrue(ExerciseGenerator.accepts(Operator.DIVIDE, Fraction.of(1), Fraction.of(3)));
        assertFalse(ExerciseGenerator.accepts(Operator.DIVIDE, Fraction.of(3), Fraction.of(3)));
        assertFalse(ExerciseGenerator.accepts(Operator.DIVIDE, Fraction.ZERO, Fraction.of(3)));
        assertFalse(ExerciseGenerator.accepts(Operator.DIVIDE, Fraction.of(3), Fraction.ZERO));
        assertTrue(ExerciseGenerator.accepts(Operator.ADD, Fraction.ZERO, Fraction.ZERO));
        assertTrue(ExerciseGenerator.accepts(Operator.MULTIPLY, Fraction.of(9), Fraction.of(9)));
    }

    @Test
    public void invalidOptionsAreRejected() {
        assertThrows(ConfigurationException.class, () -> GeneratorOptions.builder().range(0).build());
        assertThrows(ConfigurationException.class, () -> GeneratorOptions.builder().count(0).build());
        assertThrows(ConfigurationException.class, () -> GeneratorOptions.builder().attachAttempts(0).build());
    }
}
