package com.arithmeticexercises;

import java.util.Collections;
import java.util.List;

/** Accepted exercises of one batch plus its counters. */
public final class GenerationResult {
    private final List<Exercise> exercises;
    private final GenerationStats stats;
    private final int requested;

    GenerationResult(List<Exercise> exercises, GenerationStats stats, int requested) {
        this.exercises = Collections.unmodifiableList(exercises);
        this.stats = stats;
        this.requested = requested;
    }

    public List<Exercise> exercises() { return exercises; }
    public GenerationStats stats() { return stats; }
    public int requested() { return requested; }

    /** False when the attempt budget ran out before the requested count was reached. */
    public boolean isComplete() { return exercises.size() >= requested; }
}
