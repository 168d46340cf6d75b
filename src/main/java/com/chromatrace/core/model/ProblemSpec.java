package com.chromatrace.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * A coloring problem: {@code n} variables, each taking one of {@code k} colors,
 * with an inequality constraint for every pair.
 *
 * <p>Pairs are normalized, deduplicated and sorted on construction so that every
 * consumer (program generation in particular) iterates them in the same order.
 *
 * @param n     number of variables (graph nodes), {@code >= 0}
 * @param k     number of colors per variable, {@code >= 1}
 * @param pairs inequality constraints, each index in {@code [0, n)}
 */
public record ProblemSpec(
    int n,
    int k,
    List<ColorPair> pairs
) implements Serializable {

    public ProblemSpec {
        if (n < 0) {
            throw new IllegalArgumentException("Variable count must be >= 0, got " + n);
        }
        if (k < 1) {
            throw new IllegalArgumentException("Color count must be >= 1, got " + k);
        }
        var normalized = new TreeSet<ColorPair>();
        if (pairs != null) {
            for (ColorPair pair : pairs) {
                if (pair.second() >= n) {
                    throw new IllegalArgumentException(
                            "Pair " + pair + " references a variable outside [0, " + n + ")");
                }
                normalized.add(pair);
            }
        }
        pairs = List.copyOf(normalized);
    }

    public static ProblemSpec of(int n, int k, Collection<ColorPair> pairs) {
        return new ProblemSpec(n, k, List.copyOf(pairs));
    }

    /**
     * Builds a problem from raw {@code [i, j]} edge arrays, as produced by the graph editor.
     */
    public static ProblemSpec fromEdges(int n, int k, int[][] edges) {
        var pairs = new TreeSet<ColorPair>();
        for (int[] edge : edges) {
            if (edge.length != 2) {
                throw new IllegalArgumentException("Edge must have exactly two endpoints");
            }
            pairs.add(new ColorPair(edge[0], edge[1]));
        }
        return new ProblemSpec(n, k, List.copyOf(pairs));
    }

    /**
     * Size of the full assignment space, {@code k^n}.
     *
     * @throws ArithmeticException if the count does not fit in a {@code long}
     */
    public long totalAssignments() {
        long total = 1;
        for (int i = 0; i < n; i++) {
            total = Math.multiplyExact(total, k);
        }
        return total;
    }
}
