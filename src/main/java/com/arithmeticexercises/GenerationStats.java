package com.arithmeticexercises;

import java.util.ArrayList;
import java.util.List;

/** Counters for one generation batch; written as Perf.txt when diagnostics are on. */
public final class GenerationStats {
    public int range;
    public int target;
    public int generated;
    public long attempts;
    public int duplicates;
    public int zeroDivisions;
    public long elapsedMillis;
    private final int[] opCounts;      // opCounts[k-1] = problems with k operators

    public GenerationStats(int maxOperators) {
        this.opCounts = new int[maxOperators];
    }

    void recordAccepted(int ops) {
        generated++;
        opCounts[ops - 1]++;
    }

    public int withOperators(int ops) {
        return ops >= 1 && ops <= opCounts.length ? opCounts[ops - 1] : 0;
    }

    /** Key-value report lines. */
    public List<String> toLines() {
        List<String> out = new ArrayList<>();
        out.add("Range r: " + range);
        out.add("Target n: " + target);
        out.add("Generated: " + generated);
        out.add("Attempts: " + attempts);
        out.add("Duplicates skipped: " + duplicates);
        out.add("ZeroDivision skipped: " + zeroDivisions);
        StringBuilder hist = new StringBuilder("Op count distribution: ");
        for (int k = 1; k <= opCounts.length; k++) {
            if (k > 1) hist.append(", ");
            hist.append(k).append("->").append(opCounts[k - 1]);
        }
        out.add(hist.toString());
        out.add("Time: " + elapsedMillis + " ms");
        return out;
    }

    @Override
    public String toString() {
        return String.join(System.lineSeparator(), toLines());
    }
}
